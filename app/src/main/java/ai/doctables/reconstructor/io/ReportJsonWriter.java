package ai.doctables.reconstructor.io;

import ai.doctables.reconstructor.engine.ReconstructionResult;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.profile.DocumentMetadata;
import ai.doctables.reconstructor.validate.ValidationIssue;
import ai.doctables.reconstructor.validate.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Renders validation reports and reconstruction results as JSON for the audit trail.
 */
public class ReportJsonWriter {

    static final String RESULT_SUFFIX = ".reconstruction.json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    public ObjectNode reportNode(ValidationReport report) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("overall_status", report.overallStatus().label());
        ArrayNode issues = node.putArray("issues");
        for (ValidationIssue issue : report.issues()) {
            ObjectNode issueNode = issues.addObject();
            issueNode.put("severity", issue.severity().label());
            issueNode.put("message", issue.message());
            issueNode.put("table_name", issue.tableName());
            issue.rowIndex().ifPresentOrElse(index -> issueNode.put("row_index", index),
                    () -> issueNode.putNull("row_index"));
            putOptional(issueNode, "column_name", issue.columnName());
            issueNode.set("details", MAPPER.valueToTree(issue.details()));
        }
        ObjectNode summary = node.putObject("summary");
        summary.put("tables_validated", report.tablesValidated());
        summary.put("tables_passed", report.tablesPassed());
        summary.put("tables_with_warnings", report.tablesWithWarnings());
        summary.put("tables_failed", report.tablesFailed());
        node.put("timestamp", TIMESTAMP_FORMAT.format(report.timestamp().atOffset(ZoneOffset.UTC)));
        return node;
    }

    public ObjectNode tableNode(LogicalTable table, String name) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", name);
        node.put("table_type", table.tableType().label());
        ArrayNode pages = node.putArray("source_pages");
        table.sourcePages().forEach(pages::add);
        putOptional(node, "segmentation_strategy", table.segmentationStrategy().map(strategy -> strategy.tag()));
        putOptional(node, "section_title", table.sectionTitle());
        table.scoreDomain().ifPresentOrElse(domain -> node.set("score_domain", domainNode(domain)),
                () -> node.putNull("score_domain"));
        node.put("has_header", table.schema().hasHeader());
        node.put("column_count", table.schema().columnCount());
        ArrayNode headers = node.putArray("headers");
        table.schema().headers().forEach(headers::add);
        node.set("data", MAPPER.valueToTree(table.data()));
        return node;
    }

    public ObjectNode resultNode(ReconstructionResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("document", result.documentName());
        result.profileMatch().ifPresentOrElse(match -> {
            ObjectNode profile = node.putObject("profile");
            profile.put("id", match.profile().id());
            profile.put("version", match.profile().version());
            profile.put("confidence", match.confidence());
        }, () -> node.putNull("profile"));
        node.put("segmentation_strategy", result.strategy().tag());
        node.put("extraction_mode", result.extractionMode().tag());
        node.set("metadata", metadataNode(result.metadata()));
        putOptional(node, "summary", result.summary());
        node.set("validation", reportNode(result.report()));
        ArrayNode tables = node.putArray("tables");
        List<LogicalTable> routed = result.routedTables();
        for (int i = 0; i < routed.size(); i++) {
            String name = i < result.tableNames().size() ? result.tableNames().get(i) : "Table_" + (i + 1);
            tables.add(tableNode(routed.get(i), name));
        }
        return node;
    }

    public String writeReport(ValidationReport report) {
        return toJson(reportNode(report));
    }

    /**
     * Writes {@code <document>.reconstruction.json} into {@code directory} and returns its path.
     */
    public Path write(ReconstructionResult result, Path directory) {
        Path target = directory.resolve(result.documentName() + RESULT_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.writeString(target, toJson(resultNode(result)) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write reconstruction result: " + target, ex);
        }
        return target;
    }

    private ObjectNode domainNode(ScoreDomain domain) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", domain.name());
        node.put("min_score", domain.minScore());
        node.put("max_score", domain.maxScore());
        node.put("description", domain.description());
        return node;
    }

    private ObjectNode metadataNode(DocumentMetadata metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        putOptional(node, "title", metadata.title());
        putOptional(node, "organization", metadata.organization());
        putOptional(node, "reporting_period", metadata.reportingPeriod());
        putOptional(node, "subject_or_code", metadata.subjectOrCode());
        putOptional(node, "profile_id", metadata.profileId());
        putOptional(node, "profile_version", metadata.profileVersion());
        node.put("profile_confidence", metadata.profileConfidence());
        return node;
    }

    private static void putOptional(ObjectNode node, String field, Optional<String> value) {
        value.ifPresentOrElse(present -> node.put(field, present), () -> node.putNull(field));
    }

    private static String toJson(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize JSON", ex);
        }
    }
}
