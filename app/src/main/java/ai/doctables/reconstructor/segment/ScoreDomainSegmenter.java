package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.config.SegmentationSettings;
import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges every fragment regardless of page and regroups the rows by the score domain their
 * leading value falls into. A row matching several overlapping domains lands in each of them.
 */
public class ScoreDomainSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreDomainSegmenter.class);
    private static final int SCORE_COLUMN = 0;

    private final double domainGapThreshold;

    public ScoreDomainSegmenter() {
        this(SegmentationSettings.DEFAULT_DOMAIN_GAP_THRESHOLD);
    }

    public ScoreDomainSegmenter(double domainGapThreshold) {
        if (domainGapThreshold < 0.0) {
            throw new IllegalArgumentException("domainGapThreshold must be zero or greater");
        }
        this.domainGapThreshold = domainGapThreshold;
    }

    public List<LogicalTable> segment(List<Fragment> fragments, List<ScoreDomain> domains) {
        MergedFragments merged = MergedFragments.of(fragments);
        if (merged.isEmpty()) {
            return List.of();
        }
        List<String> header = merged.header();
        List<List<String>> dataRows = merged.dataRows();

        ScoreDomainRegistry registry = ScoreDomainRegistry.of(domains);
        if (registry.isEmpty()) {
            registry = ScoreDomainRegistry.detect(dataRows, domainGapThreshold);
            LOGGER.debug("Detected {} score domains from data", registry.domains().size());
        }

        List<LogicalTable> tables = new ArrayList<>();
        for (ScoreDomain domain : registry.domains()) {
            List<List<String>> domainRows = new ArrayList<>();
            for (List<String> row : dataRows) {
                if (row.size() <= SCORE_COLUMN) {
                    continue;
                }
                OptionalDouble score = CellValues.parseNumber(row.get(SCORE_COLUMN));
                if (score.isPresent() && domain.contains(score.getAsDouble())) {
                    domainRows.add(row);
                }
            }
            LOGGER.debug("Domain {} matched {} rows", domain.name(), domainRows.size());
            if (!domainRows.isEmpty()) {
                tables.add(LogicalTable.logical(header, domainRows, merged.pages(),
                        SegmentationStrategy.SCORE_DOMAIN, null, domain));
            }
        }
        return tables;
    }
}
