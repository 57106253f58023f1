package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.segment.CellValues;
import java.util.List;

/**
 * Warns about orphaned rows in rosters: two consecutive rows below the first that each hold a
 * single non-blank cell.
 */
public class RosterTableRule implements TableRule {

    @Override
    public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
        if (!TableClassifier.isRosterTable(table)) {
            return ValidationStatus.PASSED;
        }
        ValidationStatus status = ValidationStatus.PASSED;
        List<List<String>> rows = table.data();
        for (int i = 1; i < rows.size() - 1; i++) {
            List<String> cells = CellValues.nonBlankCells(rows.get(i));
            if (cells.size() == 1 && CellValues.nonBlankCells(rows.get(i + 1)).size() == 1) {
                report.addIssue(ValidationIssue.of(ValidationStatus.WARNING, "Possible orphan row detected", tableName)
                        .atRow(i)
                        .withDetail("content", cells.get(0)));
                status = ValidationStatus.WARNING;
            }
        }
        return status;
    }
}
