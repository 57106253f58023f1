package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.config.SegmentationSettings;
import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches fragments to the segmenter matching the requested strategy.
 */
public class TableSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableSegmenter.class);

    private final StrategyDetector strategyDetector;
    private final ScoreDomainSegmenter scoreDomainSegmenter;
    private final HeaderRepetitionSegmenter headerRepetitionSegmenter;

    public TableSegmenter() {
        this(SegmentationSettings.defaults());
    }

    public TableSegmenter(SegmentationSettings settings) {
        this(new StrategyDetector(settings.numericRatioThreshold()),
                new ScoreDomainSegmenter(settings.domainGapThreshold()),
                new HeaderRepetitionSegmenter(settings.headerRepeatMinimum()));
    }

    public TableSegmenter(StrategyDetector strategyDetector,
                          ScoreDomainSegmenter scoreDomainSegmenter,
                          HeaderRepetitionSegmenter headerRepetitionSegmenter) {
        this.strategyDetector = Objects.requireNonNull(strategyDetector, "strategyDetector");
        this.scoreDomainSegmenter = Objects.requireNonNull(scoreDomainSegmenter, "scoreDomainSegmenter");
        this.headerRepetitionSegmenter = Objects.requireNonNull(headerRepetitionSegmenter, "headerRepetitionSegmenter");
    }

    public SegmentationStrategy detectStrategy(List<Fragment> fragments) {
        return strategyDetector.detect(fragments);
    }

    /**
     * Segments with the given strategy, or with the detected one when {@code strategy} is empty.
     */
    public List<LogicalTable> segment(List<Fragment> fragments,
                                      Optional<SegmentationStrategy> strategy,
                                      List<ScoreDomain> scoreDomains) {
        SegmentationStrategy resolved = strategy.orElseGet(() -> strategyDetector.detect(fragments));
        return segment(fragments, resolved, scoreDomains);
    }

    /**
     * Segments with a strategy given by its tag.
     *
     * @throws SegmentationException when the tag is not a known strategy
     */
    public List<LogicalTable> segment(List<Fragment> fragments, String strategyTag, List<ScoreDomain> scoreDomains) {
        return segment(fragments, SegmentationStrategy.from(strategyTag), scoreDomains);
    }

    public List<LogicalTable> segment(List<Fragment> fragments,
                                      SegmentationStrategy strategy,
                                      List<ScoreDomain> scoreDomains) {
        if (strategy == null) {
            throw new SegmentationException("Segmentation strategy must be provided");
        }
        List<LogicalTable> tables = switch (strategy) {
            case SCORE_DOMAIN -> scoreDomainSegmenter.segment(fragments, scoreDomains);
            case HEADER_REPETITION -> headerRepetitionSegmenter.segment(fragments);
        };
        LOGGER.info("Segmented {} fragments into {} logical tables using {}",
                fragments == null ? 0 : fragments.size(), tables.size(), strategy.tag());
        return tables;
    }
}
