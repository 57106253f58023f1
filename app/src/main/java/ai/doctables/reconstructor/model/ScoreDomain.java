package ai.doctables.reconstructor.model;

import java.util.Objects;

/**
 * Named inclusive numeric range used to route rows by their leading score value.
 */
public record ScoreDomain(String name, double minScore, double maxScore, String description) {

    public ScoreDomain {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (Double.isNaN(minScore) || Double.isNaN(maxScore) || minScore > maxScore) {
            throw new IllegalArgumentException("invalid range [" + minScore + ", " + maxScore + "] for " + name);
        }
        description = Objects.requireNonNullElse(description, "");
    }

    public ScoreDomain(String name, double minScore, double maxScore) {
        this(name, minScore, maxScore, "");
    }

    public boolean contains(double score) {
        return score >= minScore && score <= maxScore;
    }
}
