package ai.doctables.reconstructor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single table extracted from one page by the ingestion layer, before any cross-page reassembly.
 */
public record Fragment(int page, int tableIndex, List<List<String>> data, String source) {

    private static final String DEFAULT_SOURCE = "unknown";

    public Fragment {
        if (page < 1) {
            throw new IllegalArgumentException("page must be 1 or greater, got " + page);
        }
        data = copyRows(data);
        source = source == null || source.isBlank() ? DEFAULT_SOURCE : source;
    }

    public Fragment(int page, List<List<String>> data) {
        this(page, 0, data, DEFAULT_SOURCE);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Copies rows into immutable lists, replacing missing cells with empty strings.
     */
    static List<List<String>> copyRows(List<List<String>> rows) {
        if (rows == null) {
            return List.of();
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row == null) {
                copy.add(List.of());
                continue;
            }
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(Objects.requireNonNullElse(cell, ""));
            }
            copy.add(List.copyOf(cells));
        }
        return List.copyOf(copy);
    }
}
