package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;

/**
 * One check of the validation chain. Rules append their findings to the report and return the
 * worst severity they raised for the table.
 */
@FunctionalInterface
public interface TableRule {

    ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report);

    default String name() {
        return getClass().getSimpleName();
    }
}
