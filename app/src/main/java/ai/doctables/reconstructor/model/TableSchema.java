package ai.doctables.reconstructor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Column layout of a table.
 */
public record TableSchema(List<String> headers, int columnCount, boolean hasHeader, List<Integer> headerRowIndices) {

    public TableSchema {
        headers = List.copyOf(Objects.requireNonNull(headers, "headers"));
        headerRowIndices = List.copyOf(headerRowIndices == null ? List.of() : headerRowIndices);
        if (columnCount < 0) {
            throw new IllegalArgumentException("columnCount must be zero or greater");
        }
        if (hasHeader && columnCount != headers.size()) {
            throw new IllegalArgumentException("columnCount " + columnCount
                    + " does not match header size " + headers.size());
        }
    }

    /**
     * Schema for a table whose first row is its header.
     */
    public static TableSchema withHeader(List<String> header) {
        return new TableSchema(header, header.size(), true, List.of(0));
    }

    /**
     * Schema for a headerless table; headers are synthesized as {@code Column_1..n}.
     */
    public static TableSchema withoutHeader(int columnCount) {
        List<String> headers = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            headers.add("Column_" + i);
        }
        return new TableSchema(headers, columnCount, false, List.of());
    }
}
