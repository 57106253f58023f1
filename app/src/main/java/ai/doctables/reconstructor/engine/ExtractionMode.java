package ai.doctables.reconstructor.engine;

import ai.doctables.reconstructor.model.LogicalTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Which reconstructed tables a conversion validates and hands back.
 */
public enum ExtractionMode {
    HYBRID("hybrid"),
    PAGE_ONLY("page_only"),
    LOGICAL_ONLY("logical_only");

    private final String tag;

    ExtractionMode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ExtractionMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Extraction mode must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ExtractionMode mode : values()) {
            if (mode.tag.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown extraction mode: " + raw);
    }

    /**
     * Page tables first, then logical tables, filtered by this mode.
     */
    public List<LogicalTable> route(List<LogicalTable> pageTables, List<LogicalTable> logicalTables) {
        return switch (this) {
            case HYBRID -> {
                List<LogicalTable> all = new ArrayList<>(pageTables.size() + logicalTables.size());
                all.addAll(pageTables);
                all.addAll(logicalTables);
                yield List.copyOf(all);
            }
            case PAGE_ONLY -> List.copyOf(pageTables);
            case LOGICAL_ONLY -> List.copyOf(logicalTables);
        };
    }
}
