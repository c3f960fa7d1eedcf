package io.hearthwarrio.actionspace.core.pipeline;

import io.hearthwarrio.actionspace.core.AccessibilityNode;
import io.hearthwarrio.actionspace.core.EmptyTreeException;
import io.hearthwarrio.actionspace.core.NodeCategory;
import io.hearthwarrio.actionspace.core.NodeRole;
import io.hearthwarrio.actionspace.core.ids.IdAssigner;
import io.hearthwarrio.actionspace.core.ids.IdSynchronizer;
import io.hearthwarrio.actionspace.core.processing.DialogFocus;
import io.hearthwarrio.actionspace.core.processing.PruningConfig;
import io.hearthwarrio.actionspace.core.processing.TreeFolder;
import io.hearthwarrio.actionspace.core.processing.TreePruner;

import java.util.Objects;
import java.util.Set;

/**
 * Turns accessibility snapshots into a {@link ProcessedTree}.
 * <p>
 * The simple tree owns the ID space. The raw and processed trees receive their non-image IDs from it,
 * images are labeled on the raw tree and copied onto the processed tree by role and name, in document order.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class AccessibilityTreePipeline {

    public static final Set<String> IMAGE_ROLES = Set.of(NodeRole.IMAGE.getValue(), NodeRole.IMG.getValue());

    private final PruningConfig config;
    private final boolean softConsistencyCheck;

    public AccessibilityTreePipeline() {
        this(PruningConfig.DEFAULT, false);
    }

    public AccessibilityTreePipeline(PruningConfig config) {
        this(config, false);
    }

    private AccessibilityTreePipeline(PruningConfig config, boolean softConsistencyCheck) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.softConsistencyCheck = softConsistencyCheck;
    }

    public AccessibilityTreePipeline withPruningConfig(PruningConfig config) {
        return new AccessibilityTreePipeline(config, softConsistencyCheck);
    }

    /**
     * Accepts names contained in one another when comparing the simple and raw trees.
     */
    public AccessibilityTreePipeline withSoftConsistencyCheck(boolean soft) {
        return new AccessibilityTreePipeline(config, soft);
    }

    public PruningConfig getConfig() {
        return config;
    }

    public ProcessedTree process(AccessibilityNode raw) {
        return process(raw, raw);
    }

    /**
     * @param raw    full snapshot
     * @param simple snapshot with uninteresting nodes already dropped by the browser (may be the raw one)
     * @throws EmptyTreeException when a stage removes every node
     * @throws io.hearthwarrio.actionspace.core.StructuralInconsistencyException when the trees cannot share IDs
     */
    public ProcessedTree process(AccessibilityNode raw, AccessibilityNode simple) {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(simple, "simple must not be null");

        TreePruner pruner = new TreePruner(config);

        AccessibilityNode simpleTree = pruner.prune(simple)
                .orElseThrow(() -> new EmptyTreeException("pruning the simple tree"));
        simpleTree = IdAssigner.assignIds(simpleTree);

        AccessibilityNode rawTree = pruner.prune(raw)
                .orElseThrow(() -> new EmptyTreeException("pruning the raw tree"));
        rawTree = IdSynchronizer.syncIds(rawTree, simpleTree, AccessibilityTreePipeline::isActionable);
        rawTree = IdAssigner.assignIds(rawTree, IMAGE_ROLES);

        AccessibilityNode folded = new TreeFolder(config).fold(raw);
        AccessibilityNode processed = pruner.prune(folded)
                .orElseThrow(() -> new EmptyTreeException("pruning the folded tree"));
        processed = IdSynchronizer.syncIds(processed, simpleTree, AccessibilityTreePipeline::isActionable);
        processed = IdSynchronizer.syncImageIds(processed, rawTree);
        processed = DialogFocus.focus(processed);

        if (softConsistencyCheck) {
            return ProcessedTree.softChecked(processed, simpleTree, rawTree);
        }
        return ProcessedTree.of(processed, simpleTree, rawTree);
    }

    private static boolean isActionable(AccessibilityNode node) {
        return node.getRole().idPrefix().isPresent() && !node.getRole().in(NodeCategory.IMAGE);
    }
}
