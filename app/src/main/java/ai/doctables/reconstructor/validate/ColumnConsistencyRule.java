package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;
import java.util.List;

/**
 * Warns about every row whose cell count differs from the schema's column count.
 */
public class ColumnConsistencyRule implements TableRule {

    @Override
    public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
        int expected = table.schema().columnCount();
        ValidationStatus status = ValidationStatus.PASSED;
        List<List<String>> rows = table.data();
        for (int i = 0; i < rows.size(); i++) {
            int actual = rows.get(i).size();
            if (actual != expected) {
                report.addIssue(ValidationIssue.of(ValidationStatus.WARNING,
                                "Inconsistent column count: expected " + expected + ", got " + actual, tableName)
                        .atRow(i)
                        .withDetail("expected", expected)
                        .withDetail("actual", actual));
                status = ValidationStatus.WARNING;
            }
        }
        return status;
    }
}
