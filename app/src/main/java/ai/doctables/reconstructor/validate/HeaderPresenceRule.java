package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;

/**
 * Warns when a non-empty table carries no detected header.
 */
public class HeaderPresenceRule implements TableRule {

    @Override
    public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
        if (table.schema().hasHeader() || table.isEmpty()) {
            return ValidationStatus.PASSED;
        }
        report.addIssue(ValidationIssue.of(ValidationStatus.WARNING, "Table has no detected header", tableName)
                .withDetail("rows", table.rowCount()));
        return ValidationStatus.WARNING;
    }
}
