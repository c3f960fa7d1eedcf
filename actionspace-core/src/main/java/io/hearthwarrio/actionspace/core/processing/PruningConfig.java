package io.hearthwarrio.actionspace.core.processing;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.Role;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable pruning policy shared by {@link TreePruner} and {@link TreeFolder}.
 * <p>
 * Use the {@code withX} methods to derive a modified copy.
 */
public final class PruningConfig {

    /**
     * Roles that are browser rendering artifacts rather than content.
     */
    public static final Set<String> DEFAULT_PRUNE_ROLES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "InlineTextBox",
            NodeRole.LIST_MARKER.getValue(),
            NodeRole.LINE_BREAK.getValue()
    )));

    public static final PruningConfig DEFAULT = new PruningConfig(
            false,
            false,
            true,
            true,
            DEFAULT_PRUNE_ROLES,
            false,
            TextGroupingThresholds.DEFAULT
    );

    private final boolean pruneImages;
    private final boolean pruneTexts;
    private final boolean pruneEmptyStructurals;
    private final boolean pruneIframes;
    private final Set<String> pruneRoles;
    private final boolean groupTexts;
    private final TextGroupingThresholds textGrouping;

    private PruningConfig(
            boolean pruneImages,
            boolean pruneTexts,
            boolean pruneEmptyStructurals,
            boolean pruneIframes,
            Set<String> pruneRoles,
            boolean groupTexts,
            TextGroupingThresholds textGrouping
    ) {
        this.pruneImages = pruneImages;
        this.pruneTexts = pruneTexts;
        this.pruneEmptyStructurals = pruneEmptyStructurals;
        this.pruneIframes = pruneIframes;
        this.pruneRoles = Collections.unmodifiableSet(new LinkedHashSet<>(
                Objects.requireNonNull(pruneRoles, "pruneRoles must not be null")));
        this.groupTexts = groupTexts;
        this.textGrouping = Objects.requireNonNull(textGrouping, "textGrouping must not be null");
    }

    public PruningConfig withPruneImages(boolean pruneImages) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    public PruningConfig withPruneTexts(boolean pruneTexts) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    public PruningConfig withPruneEmptyStructurals(boolean pruneEmptyStructurals) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    public PruningConfig withPruneIframes(boolean pruneIframes) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    /**
     * Replaces the set of always-pruned roles.
     *
     * @param roles role values (e.g. {@code "LineBreak"})
     * @return modified copy
     */
    public PruningConfig withPruneRoles(String... roles) {
        Set<String> next = new LinkedHashSet<>();
        if (roles != null) {
            for (String r : roles) {
                if (r != null && !r.isBlank()) {
                    next.add(r);
                }
            }
        }
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, next, groupTexts, textGrouping);
    }

    public PruningConfig withGroupTexts(boolean groupTexts) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    public PruningConfig withTextGrouping(TextGroupingThresholds textGrouping) {
        return new PruningConfig(pruneImages, pruneTexts, pruneEmptyStructurals, pruneIframes, pruneRoles, groupTexts, textGrouping);
    }

    public boolean isPruneImages() {
        return pruneImages;
    }

    public boolean isPruneTexts() {
        return pruneTexts;
    }

    public boolean isPruneEmptyStructurals() {
        return pruneEmptyStructurals;
    }

    public boolean isPruneIframes() {
        return pruneIframes;
    }

    public Set<String> getPruneRoles() {
        return pruneRoles;
    }

    public boolean isGroupTexts() {
        return groupTexts;
    }

    public TextGroupingThresholds getTextGrouping() {
        return textGrouping;
    }

    /**
     * Decides whether a node, taken with its current children, should be removed.
     * <p>
     * Rules are evaluated in order and the first applicable one wins.
     *
     * @param node node to check
     * @return true if the node carries nothing worth keeping
     */
    public boolean shouldPrune(AccessibilityNode node) {
        Role role = node.getRole();
        if (role.in(NodeCategory.INTERACTION)) {
            return false;
        }
        if (role.in(NodeCategory.IMAGE)) {
            return pruneImages;
        }

        boolean nameEmpty = node.hasBlankName();
        boolean childrenEmpty = !node.hasChildren();

        if (role.in(NodeCategory.TEXT)) {
            return pruneTexts || (nameEmpty && childrenEmpty);
        }
        if (role.in(NodeCategory.STRUCTURAL)) {
            return pruneEmptyStructurals && childrenEmpty;
        }
        if (pruneRoles.contains(role.getValue())) {
            return true;
        }
        if (!childrenEmpty) {
            return false;
        }
        if (role.is(NodeRole.IFRAME)) {
            return pruneIframes;
        }
        return role.is(NodeRole.NONE) || nameEmpty;
    }

    /**
     * Roles that survive pruning regardless of their children.
     */
    public Set<String> importantRoles() {
        Set<String> out = new LinkedHashSet<>(NodeCategory.INTERACTION.roles());
        if (!pruneTexts) {
            out.addAll(NodeCategory.TEXT.roles());
        }
        if (!pruneImages) {
            out.addAll(NodeCategory.IMAGE.roles());
        }
        return Collections.unmodifiableSet(out);
    }

    /**
     * Roles that never survive pruning.
     */
    public Set<String> pruningRoles() {
        Set<String> out = new LinkedHashSet<>(pruneRoles);
        if (pruneTexts) {
            out.addAll(NodeCategory.TEXT.roles());
        }
        if (pruneImages) {
            out.addAll(NodeCategory.IMAGE.roles());
        }
        if (pruneIframes) {
            out.add(NodeRole.IFRAME.getValue());
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String toString() {
        return "PruningConfig{" +
                "pruneImages=" + pruneImages +
                ", pruneTexts=" + pruneTexts +
                ", pruneEmptyStructurals=" + pruneEmptyStructurals +
                ", pruneIframes=" + pruneIframes +
                ", pruneRoles=" + pruneRoles +
                ", groupTexts=" + groupTexts +
                '}';
    }
}
