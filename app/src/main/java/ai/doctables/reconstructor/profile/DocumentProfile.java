package ai.doctables.reconstructor.profile;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recognizes a known document type and supplies the segmentation it needs.
 */
public interface DocumentProfile {

    String id();

    String version();

    /**
     * Scores how well the document matches this profile.
     *
     * @param fragments raw fragments in extraction order
     * @param pageTexts full text of every page, aligned with page numbers
     * @param context   opaque extraction context from the ingestion layer
     * @return detection with a confidence in {@code [0, 1]}
     */
    ProfileDetection detect(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context);

    SegmentationStrategy segmentationStrategy();

    default Optional<List<ScoreDomain>> scoreDomains() {
        return Optional.empty();
    }

    DocumentMetadata extractMetadata(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context);

    default Optional<String> summarize(List<LogicalTable> tables) {
        return Optional.empty();
    }
}
