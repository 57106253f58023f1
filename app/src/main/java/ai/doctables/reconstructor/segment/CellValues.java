package ai.doctables.reconstructor.segment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Cell-level helpers shared by the segmenters, the validator and the profiles.
 */
public final class CellValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private CellValues() {
    }

    /**
     * Parses a cell as a number after stripping thousands separators and surrounding whitespace.
     */
    public static OptionalDouble parseNumber(String cell) {
        if (cell == null) {
            return OptionalDouble.empty();
        }
        String cleaned = cell.replace(",", "").trim();
        if (!DECIMAL.matcher(cleaned).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(cleaned));
    }

    /**
     * Like {@link #parseNumber(String)} but also ignores percent signs.
     */
    public static OptionalDouble parseMeasure(String cell) {
        return cell == null ? OptionalDouble.empty() : parseNumber(cell.replace("%", ""));
    }

    public static boolean isNumeric(String cell) {
        return parseNumber(cell).isPresent();
    }

    public static boolean isBlank(String cell) {
        return cell == null || cell.isBlank();
    }

    /**
     * Trims and upper-cases every cell so rows can be compared regardless of case and padding.
     */
    public static List<String> normalize(List<String> row) {
        List<String> normalized = new ArrayList<>(row.size());
        for (String cell : row) {
            normalized.add(cell == null ? "" : cell.trim().toUpperCase(Locale.ROOT));
        }
        return List.copyOf(normalized);
    }

    public static List<String> nonBlankCells(List<String> row) {
        List<String> cells = new ArrayList<>();
        for (String cell : row) {
            if (!isBlank(cell)) {
                cells.add(cell.trim());
            }
        }
        return cells;
    }

    public static boolean allNonBlank(List<String> row) {
        return !row.isEmpty() && row.stream().noneMatch(CellValues::isBlank);
    }

    /**
     * Renders a number without a trailing {@code .0} when it is integral.
     */
    public static String formatNumber(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
