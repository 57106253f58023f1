package ai.doctables.reconstructor.segment;

/**
 * Algorithm used to turn fragments into logical tables.
 */
public enum SegmentationStrategy {
    SCORE_DOMAIN("score_domain"),
    HEADER_REPETITION("header_repetition");

    private final String tag;

    SegmentationStrategy(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a strategy from its tag or constant name.
     *
     * @throws SegmentationException when the tag names no known strategy
     */
    public static SegmentationStrategy from(String raw) {
        if (raw != null) {
            String value = raw.trim();
            for (SegmentationStrategy strategy : values()) {
                if (strategy.tag.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                    return strategy;
                }
            }
        }
        throw new SegmentationException("Unknown segmentation strategy: " + raw);
    }
}
