package ai.doctables.reconstructor.engine;

import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.profile.DocumentMetadata;
import ai.doctables.reconstructor.profile.ProfileMatch;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import ai.doctables.reconstructor.validate.ValidationReport;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of reconstructing one document. {@code tableNames} is aligned with {@link #routedTables()}.
 */
public record ReconstructionResult(String documentName,
                                   Optional<ProfileMatch> profileMatch,
                                   SegmentationStrategy strategy,
                                   ExtractionMode extractionMode,
                                   List<LogicalTable> pageTables,
                                   List<LogicalTable> logicalTables,
                                   List<String> tableNames,
                                   ValidationReport report,
                                   DocumentMetadata metadata,
                                   Optional<String> summary) {

    public ReconstructionResult {
        Objects.requireNonNull(documentName, "documentName");
        profileMatch = profileMatch == null ? Optional.empty() : profileMatch;
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(extractionMode, "extractionMode");
        pageTables = List.copyOf(pageTables);
        logicalTables = List.copyOf(logicalTables);
        tableNames = List.copyOf(tableNames);
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(metadata, "metadata");
        summary = summary == null ? Optional.empty() : summary;
    }

    public List<LogicalTable> routedTables() {
        return extractionMode.route(pageTables, logicalTables);
    }
}
