package ai.doctables.reconstructor.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarksDistributionProfileTest {

    private static final List<String> PAGE_TEXTS = List.of(
            "WEST AFRICAN EXAMINATIONS COUNCIL\nTASS AND CASS STATISTICS\nSUBJECT: MATHEMATICS\nSESSION: 2023 ESSAY",
            "continued");
    private static final List<Fragment> FRAGMENTS = List.of(
            new Fragment(1, List.of(
                    List.of("Score", "Frequency", "Percent", "Cumulative"),
                    List.of("0", "5", "50", "5"),
                    List.of("10", "5", "50", "10"))));

    private final MarksDistributionProfile profile = new MarksDistributionProfile();

    @Test
    void recognizesMarksDistributionReports() {
        ProfileDetection detection = profile.detect(FRAGMENTS, PAGE_TEXTS, Map.of());

        assertThat(detection.profileId()).isEqualTo("waec_marks_distribution");
        assertThat(detection.confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(detection.metadata()).containsEntry("session", "2023").containsEntry("paper_type", "essay");
    }

    @Test
    void tableShapeAloneIsNotEnough() {
        ProfileDetection detection = profile.detect(FRAGMENTS, List.of("Quarterly sales"), Map.of());

        assertThat(detection.confidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void unrelatedDocumentsScoreZero() {
        List<Fragment> fragments = List.of(new Fragment(1, List.of(
                List.of("Region", "Revenue"), List.of("North", "n/a"))));

        assertThat(profile.detect(fragments, List.of("Quarterly sales"), Map.of()).confidence()).isZero();
    }

    @Test
    void suppliesFixedScoreDomains() {
        assertThat(profile.segmentationStrategy()).isEqualTo(SegmentationStrategy.SCORE_DOMAIN);
        assertThat(profile.scoreDomains()).get().satisfies(domains -> {
            assertThat(domains).extracting(ScoreDomain::name).containsExactly(
                    "Scaled_Objective", "Scaled_Essay", "Raw_Score_40", "Raw_Score_50", "Raw_Score_60");
            assertThat(domains.get(1).minScore()).isEqualTo(15.0);
            assertThat(domains.get(1).maxScore()).isEqualTo(40.0);
        });
    }

    @Test
    void extractsTitleSubjectAndSession() {
        DocumentMetadata metadata = profile.extractMetadata(FRAGMENTS, PAGE_TEXTS, Map.of());

        assertThat(metadata.title()).contains("TASS AND CASS STATISTICS");
        assertThat(metadata.organization()).contains("West African Examinations Council (WAEC)");
        assertThat(metadata.subjectOrCode()).contains("MATHEMATICS");
        assertThat(metadata.reportingPeriod()).contains("2023");
        assertThat(metadata.profileId()).contains("waec_marks_distribution");
        assertThat(metadata.profileVersion()).contains("1.0.0");
    }

    @Test
    void fallsBackToDefaultTitle() {
        DocumentMetadata metadata = profile.extractMetadata(FRAGMENTS, List.of("no heading"), Map.of());

        assertThat(metadata.title()).contains("WAEC Marks Distribution");
        assertThat(metadata.subjectOrCode()).isEmpty();
        assertThat(metadata.reportingPeriod()).isEmpty();
    }

    @Test
    void summarizesEntriesPerDomain() {
        LogicalTable objective = LogicalTable.logical(List.of("Score"), List.of(List.of("1"), List.of("2")),
                List.of(1), SegmentationStrategy.SCORE_DOMAIN, null, new ScoreDomain("Scaled_Objective", 0, 19));

        assertThat(profile.summarize(List.of(objective)))
                .contains("WAEC Marks Distribution Summary:\n- Scaled_Objective: 2 score entries");
        assertThat(profile.summarize(List.of())).isEmpty();
    }
}
