package ai.doctables.reconstructor.config;

/**
 * Tunable parameters of the validation rule chain.
 *
 * @param percentTolerance           allowed deviation of a percent column total, as a fraction of 100
 * @param distributionKeywordMinimum header keywords required to classify a table as a distribution
 */
public record ValidationSettings(double percentTolerance, int distributionKeywordMinimum) {

    public static final double DEFAULT_PERCENT_TOLERANCE = 0.01;
    public static final int DEFAULT_DISTRIBUTION_KEYWORD_MINIMUM = 2;

    public ValidationSettings {
        if (percentTolerance < 0.0 || Double.isNaN(percentTolerance)) {
            throw new IllegalArgumentException("percentTolerance must be zero or greater");
        }
        if (distributionKeywordMinimum < 1) {
            throw new IllegalArgumentException("distributionKeywordMinimum must be at least 1");
        }
    }

    public static ValidationSettings defaults() {
        return new ValidationSettings(DEFAULT_PERCENT_TOLERANCE, DEFAULT_DISTRIBUTION_KEYWORD_MINIMUM);
    }
}
