package ai.doctables.reconstructor.validate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.doctables.reconstructor.config.ValidationSettings;
import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.model.TableSchema;
import ai.doctables.reconstructor.model.TableType;
import ai.doctables.reconstructor.segment.ScoreDomainSegmenter;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TableValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-02T03:04:05Z");

    private final TableValidator validator =
            new TableValidator(ValidationSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void duplicateRowFailsAtTheSecondOccurrence() {
        LogicalTable table = table(List.of("Name", "Position"),
                List.of("Ada", "Teacher"),
                List.of("Ben", "Bursar"),
                List.of(" Ada ", "Teacher"),
                List.of("Ben", "Bursar"));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Duplicate row found");
            assertThat(issue.rowIndex()).contains(3);
            assertThat(issue.tableName()).isEqualTo("Table_1");
            assertThat(issue.details()).containsEntry("row_content", List.of("Ada", "Teacher"));
        });
        assertThat(report.tablesFailed()).isEqualTo(1);
    }

    @Test
    void blankRowsAreNotDuplicates() {
        LogicalTable table = table(List.of("Name", "Position"),
                List.of("", ""),
                List.of("Ada", "Teacher"),
                List.of("", ""));

        assertThat(validator.validate(List.of(table)).overallStatus()).isEqualTo(ValidationStatus.PASSED);
    }

    @Test
    void warnsOnEveryRowWithTheWrongWidth() {
        LogicalTable table = table(List.of("Name", "Position"),
                List.of("Ada"),
                List.of("Ben", "Bursar", "extra"));

        ValidationReport report = validator.validate(List.of(table), List.of("Roster"));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(report.issues()).extracting(ValidationIssue::rowIndex)
                .containsExactly(Optional.of(1), Optional.of(2));
        assertThat(report.issues().get(0).details()).containsEntry("expected", 2).containsEntry("actual", 1);
        assertThat(report.issues()).allSatisfy(issue -> assertThat(issue.tableName()).isEqualTo("Roster"));
        assertThat(report.tablesWithWarnings()).isEqualTo(1);
    }

    @Test
    void warnsWhenTableHasNoHeader() {
        LogicalTable headerless = new LogicalTable(List.of(List.of("1", "2")), TableSchema.withoutHeader(2),
                List.of(1), TableType.PAGE_PRESERVED, Optional.empty(), Optional.empty(), Optional.empty());

        ValidationReport report = validator.validate(List.of(headerless));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(ValidationStatus.WARNING);
            assertThat(issue.message()).isEqualTo("Table has no detected header");
            assertThat(issue.rowIndex()).isEmpty();
        });
    }

    @Test
    void percentTotalsWithinOnePointPass() {
        LogicalTable table = table(List.of("Score", "Frequency", "Percent"),
                List.of("1", "4", "20"),
                List.of("2", "6", "30"),
                List.of("3", "10", "49.5%"));

        assertThat(validator.validate(List.of(table)).overallStatus()).isEqualTo(ValidationStatus.PASSED);
    }

    @Test
    void percentTotalsOutsideToleranceFail() {
        LogicalTable table = table(List.of("Score", "Frequency", "Percent"),
                List.of("1", "4", "20"),
                List.of("2", "6", "30"),
                List.of("3", "10", "48"));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Percent column does not sum to 100.00 (got 98.00)");
            assertThat(issue.columnName()).contains("Percent");
            assertThat(issue.details()).containsEntry("actual", 98.0).containsEntry("tolerance", 1.0);
        });
    }

    @Test
    void widerToleranceAcceptsLargerDeviation() {
        TableValidator lenient = new TableValidator(new ValidationSettings(0.05, 2), Clock.fixed(NOW, ZoneOffset.UTC));
        LogicalTable table = table(List.of("Score", "Percent"),
                List.of("1", "50"),
                List.of("2", "46"));

        assertThat(lenient.validate(List.of(table)).overallStatus()).isEqualTo(ValidationStatus.PASSED);
        assertThat(validator.validate(List.of(table)).overallStatus()).isEqualTo(ValidationStatus.FAILED);
    }

    @Test
    void cumulativeDecreaseFailsAtTheDecreasingRow() {
        LogicalTable table = table(List.of("Score", "Frequency", "Cumulative"),
                List.of("1", "10", "10"),
                List.of("2", "10", "20"),
                List.of("3", "1", "15"));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Cumulative frequency not monotonic: 15 < 20");
            assertThat(issue.rowIndex()).contains(3);
            assertThat(issue.columnName()).contains("Cumulative");
        });
    }

    @Test
    void negativeFrequenciesFail() {
        LogicalTable table = table(List.of("Score", "Frequency"),
                List.of("1", "3"),
                List.of("2", "-1"));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(ValidationStatus.FAILED);
            assertThat(issue.message()).isEqualTo("Negative frequency found: -1");
            assertThat(issue.rowIndex()).contains(2);
        });
    }

    @Test
    void scoresOutsideTheirDomainWarn() {
        LogicalTable table = LogicalTable.logical(List.of("Score", "Frequency"),
                List.of(List.of("10", "3"), List.of("25", "1")), List.of(1), SegmentationStrategy.SCORE_DOMAIN,
                null, new ScoreDomain("Scaled_Objective", 0, 19));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Score 25 outside domain range [0, 19]");
            assertThat(issue.rowIndex()).contains(2);
        });
    }

    @Test
    void tablesWithTooFewKeywordsSkipDistributionChecks() {
        LogicalTable table = table(List.of("Score", "Freq", "Cum"),
                List.of("1", "10", "10"),
                List.of("2", "-4", "6"));

        assertThat(validator.validate(List.of(table)).overallStatus()).isEqualTo(ValidationStatus.PASSED);
    }

    @Test
    void consecutiveSingleCellRowsInRostersWarn() {
        LogicalTable table = table(List.of("Name", "Position"),
                List.of("Ada Obi", "Teacher"),
                List.of("Continued", ""),
                List.of("", "overleaf"),
                List.of("Ben Ade", "Bursar"));

        ValidationReport report = validator.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.WARNING);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Possible orphan row detected");
            assertThat(issue.rowIndex()).contains(2);
            assertThat(issue.details()).containsEntry("content", "Continued");
        });
    }

    @Test
    void scoreDomainScenarioPassesStructuralChecks() {
        List<Fragment> fragments = List.of(
                new Fragment(1, List.of(List.of("Score", "Freq"), List.of("0", "5"), List.of("10", "3"))),
                new Fragment(2, List.of(List.of("15", "2"), List.of("20", "1"))));
        List<LogicalTable> tables = new ScoreDomainSegmenter().segment(fragments,
                List.of(new ScoreDomain("Low", 0, 19), new ScoreDomain("High", 20, 40)));

        ValidationReport report = validator.validate(tables);

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.PASSED);
        assertThat(report.issues()).isEmpty();
        assertThat(report.tablesValidated()).isEqualTo(2);
        assertThat(report.tablesPassed()).isEqualTo(2);
        assertThat(report.timestamp()).isEqualTo(NOW);
    }

    @Test
    void countersCoverEveryTable() {
        LogicalTable clean = table(List.of("Name", "Position"), List.of("Ada", "Teacher"));
        LogicalTable warned = table(List.of("Name", "Position"), List.of("Ada"));
        LogicalTable failed = table(List.of("Name", "Position"), List.of("Ada", "Teacher"), List.of("Ada", "Teacher"));

        ValidationReport report = validator.validate(List.of(clean, warned, failed), List.of("One"));

        assertThat(report.tablesValidated()).isEqualTo(3);
        assertThat(report.tablesPassed()).isEqualTo(1);
        assertThat(report.tablesWithWarnings()).isEqualTo(1);
        assertThat(report.tablesFailed()).isEqualTo(1);
        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(report.issues()).extracting(ValidationIssue::tableName).containsExactly("Table_2", "Table_3");
    }

    @Test
    void brokenRuleBecomesAFailedIssue() {
        TableValidator withBrokenRule = new TableValidator(List.of(new ExplodingRule(), new HeaderPresenceRule()),
                Clock.fixed(NOW, ZoneOffset.UTC));
        LogicalTable table = table(List.of("Name"), List.of("Ada"));

        ValidationReport report = withBrokenRule.validate(List.of(table));

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.FAILED);
        assertThat(report.tablesFailed()).isEqualTo(1);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).isEqualTo("Validation rule ExplodingRule could not be evaluated: boom");
            assertThat(issue.details()).containsEntry("rule", "ExplodingRule")
                    .containsEntry("error", "IllegalStateException");
        });
    }

    @Test
    void emptyInputPasses() {
        ValidationReport report = validator.validate(List.of());

        assertThat(report.overallStatus()).isEqualTo(ValidationStatus.PASSED);
        assertThat(report.tablesValidated()).isZero();
    }

    @SafeVarargs
    private static LogicalTable table(List<String> header, List<String>... rows) {
        return LogicalTable.logical(header, List.of(rows), List.of(1), SegmentationStrategy.HEADER_REPETITION, null,
                null);
    }

    private static final class ExplodingRule implements TableRule {
        @Override
        public ValidationStatus check(LogicalTable table, String tableName, ValidationReport.Accumulator report) {
            throw new IllegalStateException("boom");
        }
    }
}
