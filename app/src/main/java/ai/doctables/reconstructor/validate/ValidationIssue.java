package ai.doctables.reconstructor.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single finding raised by a validation rule.
 */
public record ValidationIssue(ValidationStatus severity,
                              String message,
                              String tableName,
                              Optional<Integer> rowIndex,
                              Optional<String> columnName,
                              Map<String, Object> details) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        message = Objects.requireNonNullElse(message, "");
        tableName = Objects.requireNonNullElse(tableName, "");
        rowIndex = rowIndex == null ? Optional.empty() : rowIndex;
        columnName = columnName == null ? Optional.empty() : columnName;
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationIssue of(ValidationStatus severity, String message, String tableName) {
        return new ValidationIssue(severity, message, tableName, Optional.empty(), Optional.empty(), Map.of());
    }

    public ValidationIssue atRow(int index) {
        return new ValidationIssue(severity, message, tableName, Optional.of(index), columnName, details);
    }

    public ValidationIssue inColumn(String name) {
        return new ValidationIssue(severity, message, tableName, rowIndex, Optional.ofNullable(name), details);
    }

    public ValidationIssue withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new ValidationIssue(severity, message, tableName, rowIndex, columnName, merged);
    }
}
