package io.hearthwarrio.actionspace.core.processing;

/**
 * Empirically tuned constants of the optional text grouping stage.
 * <p>
 * Values are kept as found on real pages; change them only with a page corpus at hand.
 */
public final class TextGroupingThresholds {

    public static final int DEFAULT_SHORT_FRAGMENT_MAX_LENGTH = 3;
    public static final int DEFAULT_BULLET_MAX_FRAGMENTS = 3;
    public static final int DEFAULT_MIN_VALID_GROUPS = 2;
    public static final int DEFAULT_MIN_INVALID_CHILDREN = 1;

    public static final TextGroupingThresholds DEFAULT = new TextGroupingThresholds(
            DEFAULT_SHORT_FRAGMENT_MAX_LENGTH,
            DEFAULT_BULLET_MAX_FRAGMENTS,
            DEFAULT_MIN_VALID_GROUPS,
            DEFAULT_MIN_INVALID_CHILDREN
    );

    private final int shortFragmentMaxLength;
    private final int bulletMaxFragments;
    private final int minValidGroups;
    private final int minInvalidChildren;

    public TextGroupingThresholds(
            int shortFragmentMaxLength,
            int bulletMaxFragments,
            int minValidGroups,
            int minInvalidChildren
    ) {
        this.shortFragmentMaxLength = shortFragmentMaxLength;
        this.bulletMaxFragments = bulletMaxFragments;
        this.minValidGroups = minValidGroups;
        this.minInvalidChildren = minInvalidChildren;
    }

    /**
     * When every text fragment is at most this long, fragments are concatenated without separator.
     */
    public int getShortFragmentMaxLength() {
        return shortFragmentMaxLength;
    }

    /**
     * Up to this many fragments are joined with {@code ", "}; more are joined with a space.
     */
    public int getBulletMaxFragments() {
        return bulletMaxFragments;
    }

    /**
     * Minimum number of text groups among the children of a mixed node.
     */
    public int getMinValidGroups() {
        return minValidGroups;
    }

    /**
     * Minimum number of non-text children of a mixed node.
     */
    public int getMinInvalidChildren() {
        return minInvalidChildren;
    }

    @Override
    public String toString() {
        return "TextGroupingThresholds{" +
                "shortFragmentMaxLength=" + shortFragmentMaxLength +
                ", bulletMaxFragments=" + bulletMaxFragments +
                ", minValidGroups=" + minValidGroups +
                ", minInvalidChildren=" + minInvalidChildren +
                '}';
    }
}
