package ai.doctables.reconstructor.segment;

import static org.assertj.core.api.Assertions.assertThat;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeaderRepetitionSegmenterTest {

    private static final List<String> HEADER = List.of("Name", "Position", "Department");

    private final HeaderRepetitionSegmenter segmenter = new HeaderRepetitionSegmenter();

    @Test
    void splitsAtRepeatedHeadersAndCarriesSectionTitles() {
        List<Fragment> fragments = List.of(
                new Fragment(1, List.of(
                        HEADER,
                        List.of("Science", "", ""),
                        List.of("Ada Obi", "Teacher", "Physics"),
                        List.of("Ben Ade", "Teacher", "Chemistry"))),
                new Fragment(2, List.of(
                        HEADER,
                        List.of("Chi Eze", "Teacher", "French"))));

        List<LogicalTable> tables = segmenter.segment(fragments);

        assertThat(tables).hasSize(2);
        LogicalTable first = tables.get(0);
        assertThat(first.sectionTitle()).contains("Science");
        assertThat(first.dataRows()).hasSize(2);
        assertThat(first.schema().headers()).isEqualTo(HEADER);
        assertThat(first.sourcePages()).containsExactly(1, 2);
        assertThat(first.segmentationStrategy()).contains(SegmentationStrategy.HEADER_REPETITION);

        LogicalTable second = tables.get(1);
        assertThat(second.sectionTitle()).isEmpty();
        assertThat(second.dataRows()).containsExactly(List.of("Chi Eze", "Teacher", "French"));
    }

    @Test
    void withoutRepeatedHeaderReturnsTheWholeMergedInput() {
        List<Fragment> fragments = List.of(
                new Fragment(1, List.of(HEADER, List.of("Ada Obi", "Teacher", "Physics"))),
                new Fragment(2, List.of(List.of("Ben Ade", "Teacher", "Chemistry"))));

        List<LogicalTable> tables = segmenter.segment(fragments);

        assertThat(tables).singleElement().satisfies(table -> {
            assertThat(table.data()).containsExactly(
                    HEADER, List.of("Ada Obi", "Teacher", "Physics"), List.of("Ben Ade", "Teacher", "Chemistry"));
            assertThat(table.schema().hasHeader()).isTrue();
            assertThat(table.segmentationStrategy()).contains(SegmentationStrategy.HEADER_REPETITION);
        });
    }

    @Test
    void dropsRowsBeforeTheFirstHeader() {
        List<Fragment> fragments = List.of(new Fragment(1, List.of(
                List.of("Preamble", "text", "here"),
                HEADER,
                List.of("Ada Obi", "Teacher", "Physics"),
                HEADER,
                List.of("Ben Ade", "Teacher", "Chemistry"))));

        List<LogicalTable> tables = segmenter.segment(fragments);

        assertThat(tables).hasSize(2);
        assertThat(tables).flatExtracting(LogicalTable::dataRows)
                .doesNotContain(List.of("Preamble", "text", "here"));
    }

    @Test
    void headersCompareIgnoringCaseAndPadding() {
        List<Fragment> fragments = List.of(
                new Fragment(1, List.of(HEADER, List.of("Ada Obi", "Teacher", "Physics"))),
                new Fragment(2, List.of(List.of(" NAME", "position ", "Department"), List.of("Ben", "Head", "Maths"))));

        assertThat(segmenter.segment(fragments)).hasSize(2);
    }

    @Test
    void headersWithoutDataFallBackToSingleTable() {
        List<Fragment> fragments = List.of(
                new Fragment(1, List.of(HEADER)),
                new Fragment(2, List.of(HEADER)));

        List<LogicalTable> tables = segmenter.segment(fragments);

        assertThat(tables).singleElement().satisfies(table -> assertThat(table.data()).containsExactly(HEADER, HEADER));
    }

    @Test
    void findsFirstSeenRepeatedRow() {
        List<List<String>> rows = List.of(
                List.of("A", "B"),
                List.of("x", "y"),
                List.of("a", "b"),
                List.of("x", "y"),
                List.of("only", ""));

        assertThat(HeaderRepetitionSegmenter.findRepeatedHeader(rows, 2)).contains(List.of("A", "B"));
        assertThat(HeaderRepetitionSegmenter.findRepeatedHeader(rows, 3)).isEmpty();
    }

    @Test
    void emptyInputProducesNoTables() {
        assertThat(segmenter.segment(List.of())).isEmpty();
    }
}
