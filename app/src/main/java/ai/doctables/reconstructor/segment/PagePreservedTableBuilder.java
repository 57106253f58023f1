package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.TableSchema;
import ai.doctables.reconstructor.model.TableType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds one table per page, keeping the page layout the document had. Several fragments on the
 * same page are stacked with a blank separator row.
 */
public class PagePreservedTableBuilder {

    public List<LogicalTable> build(List<Fragment> fragments) {
        Map<Integer, List<List<String>>> rowsByPage = new TreeMap<>();
        for (Fragment fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            List<List<String>> pageRows = rowsByPage.computeIfAbsent(fragment.page(), page -> new ArrayList<>());
            if (!pageRows.isEmpty()) {
                pageRows.add(Collections.nCopies(fragment.data().get(0).size(), ""));
            }
            pageRows.addAll(fragment.data());
        }

        List<LogicalTable> tables = new ArrayList<>(rowsByPage.size());
        for (Map.Entry<Integer, List<List<String>>> entry : rowsByPage.entrySet()) {
            List<List<String>> rows = entry.getValue();
            List<String> firstRow = rows.get(0);
            TableSchema schema = CellValues.allNonBlank(firstRow)
                    ? TableSchema.withHeader(firstRow)
                    : TableSchema.withoutHeader(firstRow.size());
            tables.add(new LogicalTable(rows, schema, List.of(entry.getKey()), TableType.PAGE_PRESERVED,
                    Optional.empty(), Optional.empty(), Optional.empty()));
        }
        return tables;
    }
}
