package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.config.ValidationSettings;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.segment.CellValues;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Numeric invariants of score-distribution tables:
 * <ul>
 *     <li>the percent column totals 100 within the configured tolerance</li>
 *     <li>frequencies are never negative</li>
 *     <li>the cumulative column never decreases</li>
 *     <li>scores stay inside the table's score domain, when it has one</li>
 * </ul>
 * Only tables whose headers carry enough distribution keywords are checked.
 */
public class DistributionTableRule implements TableRule {

    static final List<String> PERCENT_KEYWORDS = List.of("percent", "percentage", "%");
    static final List<String> CUMULATIVE_KEYWORDS = List.of("cumulative", "cum", "cum.");
    static final List<String> FREQUENCY_KEYWORDS = List.of("frequency", "freq", "f");
    static final List<String> SCORE_KEYWORDS = List.of("score", "mark", "grade");

    private final double tolerance;
    private final int minimumKeywords;

    public DistributionTableRule() {
        this(ValidationSettings.DEFAULT_PERCENT_TOLERANCE, ValidationSettings.DEFAULT_DISTRIBUTION_KEYWORD_MINIMUM);
    }

    public DistributionTableRule(double tolerance, int minimumKeywords) {
        this.tolerance = tolerance;
        this.minimumKeywords = minimumKeywords;
    }

    @Override
    public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
        if (!TableClassifier.isDistributionTable(table, minimumKeywords)) {
            return ValidationStatus.PASSED;
        }
        List<String> headers = table.schema().headers();
        List<List<String>> rows = table.data().subList(1, table.data().size());
        ValidationStatus status = ValidationStatus.PASSED;

        OptionalInt percentColumn = TableClassifier.findColumn(headers, PERCENT_KEYWORDS);
        if (percentColumn.isPresent()) {
            status = status.raiseTo(checkPercentTotal(rows, percentColumn.getAsInt(), headers, tableName, report));
        }
        OptionalInt frequencyColumn = TableClassifier.findColumn(headers, FREQUENCY_KEYWORDS);
        if (frequencyColumn.isPresent()) {
            status = status.raiseTo(checkFrequencies(rows, frequencyColumn.getAsInt(), headers, tableName, report));
        }
        OptionalInt cumulativeColumn = TableClassifier.findColumn(headers, CUMULATIVE_KEYWORDS);
        if (cumulativeColumn.isPresent()) {
            status = status.raiseTo(checkCumulative(rows, cumulativeColumn.getAsInt(), headers, tableName, report));
        }
        OptionalInt scoreColumn = TableClassifier.findColumn(headers, SCORE_KEYWORDS);
        if (table.scoreDomain().isPresent() && scoreColumn.isPresent()) {
            status = status.raiseTo(checkScoreDomain(rows, scoreColumn.getAsInt(), table.scoreDomain().get(),
                    headers, tableName, report));
        }
        return status;
    }

    private ValidationStatus checkPercentTotal(List<List<String>> rows, int column, List<String> headers,
                                               String tableName, ValidationReport.Accumulator report) {
        double total = 0.0;
        int counted = 0;
        for (List<String> row : rows) {
            OptionalDouble value = valueAt(row, column);
            if (value.isPresent()) {
                total += value.getAsDouble();
                counted++;
            }
        }
        if (counted == 0) {
            return ValidationStatus.PASSED;
        }
        double allowed = tolerance * 100;
        if (Math.abs(total - 100.0) <= allowed) {
            return ValidationStatus.PASSED;
        }
        report.addIssue(ValidationIssue.of(ValidationStatus.FAILED,
                        String.format(Locale.ROOT, "Percent column does not sum to 100.00 (got %.2f)", total), tableName)
                .inColumn(headers.get(column))
                .withDetail("expected", 100.0)
                .withDetail("actual", total)
                .withDetail("tolerance", allowed));
        return ValidationStatus.FAILED;
    }

    private ValidationStatus checkFrequencies(List<List<String>> rows, int column, List<String> headers,
                                              String tableName, ValidationReport.Accumulator report) {
        ValidationStatus status = ValidationStatus.PASSED;
        for (int i = 0; i < rows.size(); i++) {
            OptionalDouble value = valueAt(rows.get(i), column);
            if (value.isPresent() && value.getAsDouble() < 0) {
                report.addIssue(ValidationIssue.of(ValidationStatus.FAILED,
                                "Negative frequency found: " + CellValues.formatNumber(value.getAsDouble()), tableName)
                        .atRow(i + 1)
                        .inColumn(headers.get(column)));
                status = ValidationStatus.FAILED;
            }
        }
        return status;
    }

    private ValidationStatus checkCumulative(List<List<String>> rows, int column, List<String> headers,
                                             String tableName, ValidationReport.Accumulator report) {
        ValidationStatus status = ValidationStatus.PASSED;
        OptionalDouble previous = OptionalDouble.empty();
        for (int i = 0; i < rows.size(); i++) {
            OptionalDouble value = valueAt(rows.get(i), column);
            if (value.isEmpty()) {
                continue;
            }
            double current = value.getAsDouble();
            if (previous.isPresent() && current < previous.getAsDouble()) {
                report.addIssue(ValidationIssue.of(ValidationStatus.FAILED,
                                "Cumulative frequency not monotonic: " + CellValues.formatNumber(current)
                                        + " < " + CellValues.formatNumber(previous.getAsDouble()), tableName)
                        .atRow(i + 1)
                        .inColumn(headers.get(column)));
                status = ValidationStatus.FAILED;
            }
            previous = value;
        }
        return status;
    }

    private ValidationStatus checkScoreDomain(List<List<String>> rows, int column, ScoreDomain domain,
                                              List<String> headers, String tableName,
                                              ValidationReport.Accumulator report) {
        ValidationStatus status = ValidationStatus.PASSED;
        for (int i = 0; i < rows.size(); i++) {
            OptionalDouble value = valueAt(rows.get(i), column);
            if (value.isPresent() && !domain.contains(value.getAsDouble())) {
                report.addIssue(ValidationIssue.of(ValidationStatus.WARNING,
                                "Score " + CellValues.formatNumber(value.getAsDouble()) + " outside domain range ["
                                        + CellValues.formatNumber(domain.minScore()) + ", "
                                        + CellValues.formatNumber(domain.maxScore()) + "]", tableName)
                        .atRow(i + 1)
                        .inColumn(headers.get(column)));
                status = ValidationStatus.WARNING;
            }
        }
        return status;
    }

    private static OptionalDouble valueAt(List<String> row, int column) {
        return column < row.size() ? CellValues.parseMeasure(row.get(column)) : OptionalDouble.empty();
    }
}
