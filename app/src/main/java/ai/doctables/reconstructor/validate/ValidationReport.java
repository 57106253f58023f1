package ai.doctables.reconstructor.validate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of validating every table of one document. Reports are assembled through an
 * {@link Accumulator} and are immutable once frozen.
 */
public final class ValidationReport {

    private final ValidationStatus overallStatus;
    private final List<ValidationIssue> issues;
    private final int tablesValidated;
    private final int tablesPassed;
    private final int tablesWithWarnings;
    private final int tablesFailed;
    private final Instant timestamp;

    private ValidationReport(Accumulator accumulator) {
        this.overallStatus = accumulator.overallStatus;
        this.issues = List.copyOf(accumulator.issues);
        this.tablesValidated = accumulator.tablesValidated;
        this.tablesPassed = accumulator.tablesPassed;
        this.tablesWithWarnings = accumulator.tablesWithWarnings;
        this.tablesFailed = accumulator.tablesFailed;
        this.timestamp = accumulator.timestamp;
    }

    public static Accumulator accumulate(Instant timestamp) {
        return new Accumulator(timestamp);
    }

    /**
     * A passed report covering no tables, used when validation is switched off.
     */
    public static ValidationReport empty(Instant timestamp) {
        return new Accumulator(timestamp).freeze();
    }

    public ValidationStatus overallStatus() {
        return overallStatus;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public int tablesValidated() {
        return tablesValidated;
    }

    public int tablesPassed() {
        return tablesPassed;
    }

    public int tablesWithWarnings() {
        return tablesWithWarnings;
    }

    public int tablesFailed() {
        return tablesFailed;
    }

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ValidationReport[status=" + overallStatus.label() + ", issues=" + issues.size()
                + ", validated=" + tablesValidated + ", passed=" + tablesPassed
                + ", warnings=" + tablesWithWarnings + ", failed=" + tablesFailed + "]";
    }

    /**
     * Mutable side of a report: issues are appended and the overall status only escalates.
     */
    public static final class Accumulator {

        private final Instant timestamp;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private ValidationStatus overallStatus = ValidationStatus.PASSED;
        private int tablesValidated;
        private int tablesPassed;
        private int tablesWithWarnings;
        private int tablesFailed;
        private boolean frozen;

        private Accumulator(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public void addIssue(ValidationIssue issue) {
            ensureOpen();
            issues.add(Objects.requireNonNull(issue, "issue"));
            overallStatus = overallStatus.raiseTo(issue.severity());
        }

        /**
         * Counts one validated table under its worst severity.
         */
        public void recordTable(ValidationStatus worstStatus) {
            ensureOpen();
            tablesValidated++;
            switch (worstStatus) {
                case PASSED -> tablesPassed++;
                case WARNING -> tablesWithWarnings++;
                case FAILED -> tablesFailed++;
            }
            overallStatus = overallStatus.raiseTo(worstStatus);
        }

        public ValidationStatus overallStatus() {
            return overallStatus;
        }

        public ValidationReport freeze() {
            ensureOpen();
            frozen = true;
            return new ValidationReport(this);
        }

        private void ensureOpen() {
            if (frozen) {
                throw new IllegalStateException("validation report has already been frozen");
            }
        }
    }
}
