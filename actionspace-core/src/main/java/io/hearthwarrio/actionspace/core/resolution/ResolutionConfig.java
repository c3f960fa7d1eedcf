package io.hearthwarrio.actionspace.core.resolution;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tuning of the selector resolution.
 */
public final class ResolutionConfig {

    public static final int DEFAULT_TEXT_CONTEXT_MIN_DEPTH = 1;
    public static final int DEFAULT_TEXT_CONTEXT_MIN_TEXT_COUNT = 0;
    public static final Set<String> DEFAULT_TEXT_CONTEXT_ROLES =
            Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("text", "heading", "paragraph")));

    public static final ResolutionConfig DEFAULT = new ResolutionConfig(
            true,
            DEFAULT_TEXT_CONTEXT_MIN_DEPTH,
            DEFAULT_TEXT_CONTEXT_MIN_TEXT_COUNT,
            DEFAULT_TEXT_CONTEXT_ROLES
    );

    private final boolean conflictResolution;
    private final int textContextMinDepth;
    private final int textContextMinTextCount;
    private final Set<String> textContextRoles;

    private ResolutionConfig(
            boolean conflictResolution,
            int textContextMinDepth,
            int textContextMinTextCount,
            Set<String> textContextRoles
    ) {
        if (textContextMinDepth < 1) {
            throw new IllegalArgumentException("textContextMinDepth must be >= 1, got " + textContextMinDepth);
        }
        if (textContextMinTextCount < 0) {
            throw new IllegalArgumentException("textContextMinTextCount must be >= 0, got " + textContextMinTextCount);
        }
        this.conflictResolution = conflictResolution;
        this.textContextMinDepth = textContextMinDepth;
        this.textContextMinTextCount = textContextMinTextCount;
        this.textContextRoles = Set.copyOf(textContextRoles);
    }

    /**
     * When disabled, only the first strategy runs and any ambiguity is reported as a failure.
     */
    public ResolutionConfig withConflictResolution(boolean enabled) {
        return new ResolutionConfig(enabled, textContextMinDepth, textContextMinTextCount, textContextRoles);
    }

    /**
     * Closest ancestor level (1 = parent) the text context search starts from.
     */
    public ResolutionConfig withTextContextMinDepth(int minDepth) {
        return new ResolutionConfig(conflictResolution, minDepth, textContextMinTextCount, textContextRoles);
    }

    /**
     * An ancestor qualifies as text context when it holds more text names than this.
     */
    public ResolutionConfig withTextContextMinTextCount(int minTextCount) {
        return new ResolutionConfig(conflictResolution, textContextMinDepth, minTextCount, textContextRoles);
    }

    public ResolutionConfig withTextContextRoles(String... roles) {
        return new ResolutionConfig(
                conflictResolution,
                textContextMinDepth,
                textContextMinTextCount,
                new LinkedHashSet<>(Arrays.asList(roles))
        );
    }

    public boolean isConflictResolution() {
        return conflictResolution;
    }

    public int getTextContextMinDepth() {
        return textContextMinDepth;
    }

    public int getTextContextMinTextCount() {
        return textContextMinTextCount;
    }

    public Set<String> getTextContextRoles() {
        return textContextRoles;
    }

    @Override
    public String toString() {
        return "ResolutionConfig{" +
                "conflictResolution=" + conflictResolution +
                ", textContextMinDepth=" + textContextMinDepth +
                ", textContextMinTextCount=" + textContextMinTextCount +
                ", textContextRoles=" + textContextRoles +
                '}';
    }
}
