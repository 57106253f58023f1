package ai.doctables.reconstructor.validate;

/**
 * Severity lattice {@code PASSED < WARNING < FAILED}. Statuses only ever move upwards.
 */
public enum ValidationStatus {
    PASSED("passed"),
    WARNING("warning"),
    FAILED("failed");

    private final String label;

    ValidationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Returns the more severe of this status and {@code other}.
     */
    public ValidationStatus raiseTo(ValidationStatus other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
