package ai.doctables.reconstructor.config;

/**
 * Tunable heuristics used while choosing a strategy and segmenting fragments.
 *
 * @param numericRatioThreshold share of numeric first-column values that marks a fragment as a score table
 * @param domainGapThreshold    gap between consecutive sorted scores that starts a new auto-detected domain
 * @param headerRepeatMinimum   occurrences needed before a row is treated as a repeating header
 */
public record SegmentationSettings(double numericRatioThreshold, double domainGapThreshold, int headerRepeatMinimum) {

    public static final double DEFAULT_NUMERIC_RATIO_THRESHOLD = 0.7;
    public static final double DEFAULT_DOMAIN_GAP_THRESHOLD = 5;
    public static final int DEFAULT_HEADER_REPEAT_MINIMUM = 2;

    public SegmentationSettings {
        if (numericRatioThreshold <= 0.0 || numericRatioThreshold > 1.0) {
            throw new IllegalArgumentException("numericRatioThreshold must be in (0, 1]");
        }
        if (domainGapThreshold < 0.0) {
            throw new IllegalArgumentException("domainGapThreshold must be zero or greater");
        }
        if (headerRepeatMinimum < 2) {
            throw new IllegalArgumentException("headerRepeatMinimum must be at least 2");
        }
    }

    public static SegmentationSettings defaults() {
        return new SegmentationSettings(DEFAULT_NUMERIC_RATIO_THRESHOLD, DEFAULT_DOMAIN_GAP_THRESHOLD,
                DEFAULT_HEADER_REPEAT_MINIMUM);
    }
}
