package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.model.LogicalTable;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Header-keyword heuristics deciding which type-specific rules apply to a table.
 */
public final class TableClassifier {

    static final List<String> DISTRIBUTION_KEYWORDS = List.of("frequency", "percent", "cumulative", "score", "mark");
    static final List<String> ROSTER_KEYWORDS = List.of("name", "position", "department", "staff", "student", "employee");

    private TableClassifier() {
    }

    public static boolean isDistributionTable(LogicalTable table, int minimumKeywords) {
        if (table.isEmpty()) {
            return false;
        }
        List<String> headers = lowerCase(table.schema().headers());
        long matches = DISTRIBUTION_KEYWORDS.stream()
                .filter(keyword -> headers.stream().anyMatch(header -> header.contains(keyword)))
                .count();
        return matches >= minimumKeywords;
    }

    public static boolean isRosterTable(LogicalTable table) {
        if (table.isEmpty()) {
            return false;
        }
        List<String> headers = lowerCase(table.schema().headers());
        return ROSTER_KEYWORDS.stream()
                .anyMatch(keyword -> headers.stream().anyMatch(header -> header.contains(keyword)));
    }

    /**
     * Index of the first header containing any of the keywords, case-insensitively.
     */
    public static OptionalInt findColumn(List<String> headers, List<String> keywords) {
        List<String> lowered = lowerCase(headers);
        for (int i = 0; i < lowered.size(); i++) {
            String header = lowered.get(i);
            for (String keyword : keywords) {
                if (header.contains(keyword)) {
                    return OptionalInt.of(i);
                }
            }
        }
        return OptionalInt.empty();
    }

    private static List<String> lowerCase(List<String> headers) {
        return headers.stream().map(header -> header.toLowerCase(Locale.ROOT)).toList();
    }
}
