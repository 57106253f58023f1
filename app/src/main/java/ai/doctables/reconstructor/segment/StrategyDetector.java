package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.config.SegmentationSettings;
import ai.doctables.reconstructor.model.Fragment;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a segmentation strategy for a document when neither the caller nor a profile supplied one.
 */
public class StrategyDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyDetector.class);

    private final double numericRatioThreshold;

    public StrategyDetector() {
        this(SegmentationSettings.DEFAULT_NUMERIC_RATIO_THRESHOLD);
    }

    public StrategyDetector(double numericRatioThreshold) {
        if (numericRatioThreshold <= 0.0 || numericRatioThreshold > 1.0) {
            throw new IllegalArgumentException("numericRatioThreshold must be in (0, 1]");
        }
        this.numericRatioThreshold = numericRatioThreshold;
    }

    public SegmentationStrategy detect(List<Fragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return SegmentationStrategy.HEADER_REPETITION;
        }
        for (Fragment fragment : fragments) {
            double ratio = numericFirstColumnRatio(fragment.data());
            if (ratio >= numericRatioThreshold) {
                LOGGER.debug("Fragment on page {} has {} numeric first-column values", fragment.page(), ratio);
                return SegmentationStrategy.SCORE_DOMAIN;
            }
        }
        Set<List<String>> seenHeaders = new HashSet<>();
        for (Fragment fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            if (!seenHeaders.add(CellValues.normalize(fragment.data().get(0)))) {
                return SegmentationStrategy.HEADER_REPETITION;
            }
        }
        return SegmentationStrategy.HEADER_REPETITION;
    }

    /**
     * Share of numeric first-column values among the non-empty rows after the first, or {@code -1}
     * when there are no such rows.
     */
    static double numericFirstColumnRatio(List<List<String>> rows) {
        int total = 0;
        int numeric = 0;
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.isEmpty()) {
                continue;
            }
            total++;
            if (CellValues.isNumeric(row.get(0))) {
                numeric++;
            }
        }
        return total == 0 ? -1.0 : (double) numeric / total;
    }
}
