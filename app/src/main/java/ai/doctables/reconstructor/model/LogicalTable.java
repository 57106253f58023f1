package ai.doctables.reconstructor.model;

import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reconstructed table. Instances are only produced by the segmenters and the page table builder.
 */
public record LogicalTable(List<List<String>> data,
                           TableSchema schema,
                           List<Integer> sourcePages,
                           TableType tableType,
                           Optional<SegmentationStrategy> segmentationStrategy,
                           Optional<String> sectionTitle,
                           Optional<ScoreDomain> scoreDomain) {

    public LogicalTable {
        data = Fragment.copyRows(data);
        Objects.requireNonNull(schema, "schema");
        sourcePages = List.copyOf(Objects.requireNonNull(sourcePages, "sourcePages"));
        Objects.requireNonNull(tableType, "tableType");
        segmentationStrategy = segmentationStrategy == null ? Optional.empty() : segmentationStrategy;
        sectionTitle = sectionTitle == null ? Optional.empty() : sectionTitle;
        scoreDomain = scoreDomain == null ? Optional.empty() : scoreDomain;
    }

    /**
     * Builds a logical table made of {@code header} followed by {@code rows}.
     */
    public static LogicalTable logical(List<String> header,
                                       List<List<String>> rows,
                                       List<Integer> sourcePages,
                                       SegmentationStrategy strategy,
                                       String sectionTitle,
                                       ScoreDomain scoreDomain) {
        List<List<String>> data = new ArrayList<>(rows.size() + 1);
        data.add(header);
        data.addAll(rows);
        return new LogicalTable(data, TableSchema.withHeader(header), sourcePages, TableType.LOGICAL,
                Optional.ofNullable(strategy), Optional.ofNullable(sectionTitle), Optional.ofNullable(scoreDomain));
    }

    public int rowCount() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Rows below the header, or every row when the table has no header.
     */
    public List<List<String>> dataRows() {
        if (schema.hasHeader() && !data.isEmpty()) {
            return data.subList(1, data.size());
        }
        return data;
    }
}
