package ai.doctables.reconstructor.io;

import static org.assertj.core.api.Assertions.assertThat;

import ai.doctables.reconstructor.config.Config;
import ai.doctables.reconstructor.engine.ReconstructionResult;
import ai.doctables.reconstructor.engine.TableReconstructionEngine;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.profile.ProfileRegistry;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import ai.doctables.reconstructor.validate.ValidationIssue;
import ai.doctables.reconstructor.validate.ValidationReport;
import ai.doctables.reconstructor.validate.ValidationStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportJsonWriterTest {

    private static final Instant NOW = Instant.parse("2026-01-02T03:04:05Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final ReportJsonWriter writer = new ReportJsonWriter();

    @Test
    void reportCarriesAuditFields() throws IOException {
        ValidationReport.Accumulator accumulator = ValidationReport.accumulate(NOW);
        accumulator.addIssue(ValidationIssue.of(ValidationStatus.FAILED, "Duplicate row", "Scores")
                .atRow(3)
                .withDetail("duplicate_of", 1));
        accumulator.addIssue(ValidationIssue.of(ValidationStatus.WARNING, "Missing header", "Roster"));
        accumulator.recordTable(ValidationStatus.FAILED);
        accumulator.recordTable(ValidationStatus.WARNING);
        accumulator.recordTable(ValidationStatus.PASSED);

        JsonNode json = mapper.readTree(writer.writeReport(accumulator.freeze()));

        assertThat(json.fieldNames()).toIterable()
                .containsExactly("overall_status", "issues", "summary", "timestamp");
        assertThat(json.get("overall_status").asText()).isEqualTo("failed");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-01-02T03:04:05Z");

        JsonNode duplicate = json.get("issues").get(0);
        assertThat(duplicate.get("severity").asText()).isEqualTo("failed");
        assertThat(duplicate.get("table_name").asText()).isEqualTo("Scores");
        assertThat(duplicate.get("row_index").asInt()).isEqualTo(3);
        assertThat(duplicate.get("column_name").isNull()).isTrue();
        assertThat(duplicate.get("details").get("duplicate_of").asInt()).isEqualTo(1);

        JsonNode header = json.get("issues").get(1);
        assertThat(header.get("row_index").isNull()).isTrue();
        assertThat(header.get("details").isEmpty()).isTrue();

        JsonNode summary = json.get("summary");
        assertThat(summary.get("tables_validated").asInt()).isEqualTo(3);
        assertThat(summary.get("tables_passed").asInt()).isEqualTo(1);
        assertThat(summary.get("tables_with_warnings").asInt()).isEqualTo(1);
        assertThat(summary.get("tables_failed").asInt()).isEqualTo(1);
    }

    @Test
    void tableNodeDescribesDomainAndSchema() {
        ScoreDomain domain = new ScoreDomain("Raw_Score_40", 0, 40, "Raw scores out of 40");
        LogicalTable table = LogicalTable.logical(List.of("Score", "Frequency"),
                List.of(List.of("10", "4")), List.of(1, 2), SegmentationStrategy.SCORE_DOMAIN, null, domain);

        JsonNode node = writer.tableNode(table, "Raw_Score_40");

        assertThat(node.get("name").asText()).isEqualTo("Raw_Score_40");
        assertThat(node.get("table_type").asText()).isEqualTo("logical");
        assertThat(node.get("segmentation_strategy").asText()).isEqualTo("score_domain");
        assertThat(node.get("section_title").isNull()).isTrue();
        assertThat(node.get("score_domain").get("max_score").asDouble()).isEqualTo(40.0);
        assertThat(node.get("source_pages").toString()).isEqualTo("[1,2]");
        assertThat(node.get("headers").toString()).isEqualTo("[\"Score\",\"Frequency\"]");
        assertThat(node.get("data").toString()).isEqualTo("[[\"Score\",\"Frequency\"],[\"10\",\"4\"]]");
    }

    @Test
    void writesResultFileNamedAfterDocument(@TempDir Path directory) throws IOException, URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/fixtures/staff_list.json").toURI());
        TableReconstructionEngine engine = new TableReconstructionEngine(Config.defaults(),
                ProfileRegistry.withDefaults(ProfileRegistry.DEFAULT_MIN_CONFIDENCE), Clock.fixed(NOW, ZoneOffset.UTC));
        ReconstructionResult result = engine.reconstruct(new FragmentDocumentReader().read(fixture));

        Path written = writer.write(result, directory.resolve("reports"));

        assertThat(written.getFileName().toString()).isEqualTo("staff_list.reconstruction.json");
        JsonNode json = mapper.readTree(Files.readString(written));
        assertThat(json.get("document").asText()).isEqualTo("staff_list");
        assertThat(json.get("profile").get("id").asText()).isEqualTo("international_staff_list");
        assertThat(json.get("segmentation_strategy").asText()).isEqualTo("header_repetition");
        assertThat(json.get("extraction_mode").asText()).isEqualTo("hybrid");
        assertThat(json.get("validation").get("timestamp").asText()).isEqualTo("2026-01-02T03:04:05Z");
        assertThat(json.get("tables").size()).isEqualTo(result.routedTables().size());
        assertThat(json.get("tables").get(0).get("name").asText()).isEqualTo("Page_1");
    }
}
