package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fails a table on the first data row that repeats an earlier one. Entirely blank rows are ignored.
 */
public class DuplicateRowRule implements TableRule {

    @Override
    public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
        if (table.rowCount() <= 1) {
            return ValidationStatus.PASSED;
        }
        int offset = table.schema().hasHeader() ? 1 : 0;
        List<List<String>> rows = table.dataRows();
        Set<List<String>> seen = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> trimmed = rows.get(i).stream().map(String::trim).toList();
            boolean repeated = !seen.add(trimmed);
            if (repeated && trimmed.stream().anyMatch(cell -> !cell.isEmpty())) {
                report.addIssue(ValidationIssue.of(ValidationStatus.FAILED, "Duplicate row found", tableName)
                        .atRow(i + offset)
                        .withDetail("row_content", trimmed));
                return ValidationStatus.FAILED;
            }
        }
        return ValidationStatus.PASSED;
    }
}
