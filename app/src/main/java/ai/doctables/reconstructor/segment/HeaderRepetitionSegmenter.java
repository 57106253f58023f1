package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.config.SegmentationSettings;
import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.TableSchema;
import ai.doctables.reconstructor.model.TableType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges every fragment regardless of page and splits the rows wherever a recurring header row
 * reappears. Rows holding a single non-blank cell label the section that follows them.
 */
public class HeaderRepetitionSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeaderRepetitionSegmenter.class);

    private final int headerRepeatMinimum;

    public HeaderRepetitionSegmenter() {
        this(SegmentationSettings.DEFAULT_HEADER_REPEAT_MINIMUM);
    }

    public HeaderRepetitionSegmenter(int headerRepeatMinimum) {
        if (headerRepeatMinimum < 2) {
            throw new IllegalArgumentException("headerRepeatMinimum must be at least 2");
        }
        this.headerRepeatMinimum = headerRepeatMinimum;
    }

    public List<LogicalTable> segment(List<Fragment> fragments) {
        MergedFragments merged = MergedFragments.of(fragments);
        if (merged.isEmpty()) {
            return List.of();
        }

        Optional<List<String>> pattern = findRepeatedHeader(merged.rows(), headerRepeatMinimum);
        if (pattern.isEmpty()) {
            LOGGER.debug("No repeated header found across {} rows", merged.rows().size());
            return List.of(singleTable(merged));
        }
        LOGGER.debug("Repeated header pattern {}", pattern.get());

        SectionCollector collector = new SectionCollector(merged.pages());
        for (List<String> row : merged.rows()) {
            if (row.isEmpty()) {
                continue;
            }
            if (matchesPattern(row, pattern.get())) {
                collector.startSection(row);
            } else if (isSectionTitle(row)) {
                collector.pendingTitle = CellValues.nonBlankCells(row).get(0);
            } else {
                collector.append(row);
            }
        }
        collector.flush();

        if (collector.tables.isEmpty()) {
            return List.of(singleTable(merged));
        }
        return List.copyOf(collector.tables);
    }

    /**
     * Returns the first fully populated row, normalized, that occurs at least {@code minimumOccurrences} times.
     */
    public static Optional<List<String>> findRepeatedHeader(List<List<String>> rows, int minimumOccurrences) {
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (List<String> row : rows) {
            if (CellValues.allNonBlank(row)) {
                counts.merge(CellValues.normalize(row), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= minimumOccurrences)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static boolean matchesPattern(List<String> row, List<String> pattern) {
        return row.size() == pattern.size() && CellValues.normalize(row).equals(pattern);
    }

    private static boolean isSectionTitle(List<String> row) {
        return row.size() >= 2 && CellValues.nonBlankCells(row).size() == 1;
    }

    private static LogicalTable singleTable(MergedFragments merged) {
        List<String> header = merged.header();
        return new LogicalTable(merged.rows(), TableSchema.withHeader(header), merged.pages(), TableType.LOGICAL,
                Optional.of(SegmentationStrategy.HEADER_REPETITION), Optional.empty(), Optional.empty());
    }

    private static final class SectionCollector {

        private final List<Integer> pages;
        private final List<LogicalTable> tables = new ArrayList<>();
        private List<String> currentHeader;
        private List<List<String>> currentSection = new ArrayList<>();
        private String pendingTitle;

        private SectionCollector(List<Integer> pages) {
            this.pages = pages;
        }

        void startSection(List<String> header) {
            flush();
            currentHeader = header;
            currentSection = new ArrayList<>();
            pendingTitle = null;
        }

        void append(List<String> row) {
            // rows before the first header have nowhere to go
            if (currentHeader != null) {
                currentSection.add(row);
            }
        }

        void flush() {
            if (currentHeader != null && !currentSection.isEmpty()) {
                tables.add(LogicalTable.logical(currentHeader, currentSection, pages,
                        SegmentationStrategy.HEADER_REPETITION, pendingTitle, null));
            }
        }
    }
}
