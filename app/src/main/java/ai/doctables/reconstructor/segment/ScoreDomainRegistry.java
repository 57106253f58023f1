package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.model.ScoreDomain;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, ordered set of score domains, either supplied by a profile or detected from the data.
 */
public final class ScoreDomainRegistry {

    private static final ScoreDomainRegistry EMPTY = new ScoreDomainRegistry(List.of());

    private final List<ScoreDomain> domains;

    private ScoreDomainRegistry(List<ScoreDomain> domains) {
        this.domains = List.copyOf(domains);
    }

    public static ScoreDomainRegistry of(List<ScoreDomain> domains) {
        return domains == null || domains.isEmpty() ? EMPTY : new ScoreDomainRegistry(domains);
    }

    public static ScoreDomainRegistry empty() {
        return EMPTY;
    }

    /**
     * Groups the distinct first-column scores of {@code dataRows} into contiguous ranges, starting a new
     * range wherever two consecutive sorted scores are more than {@code gapThreshold} apart.
     */
    public static ScoreDomainRegistry detect(List<List<String>> dataRows, double gapThreshold) {
        SortedSet<Double> scores = new TreeSet<>();
        for (List<String> row : dataRows) {
            if (row.isEmpty()) {
                continue;
            }
            OptionalDouble score = CellValues.parseNumber(row.get(0));
            if (score.isPresent()) {
                scores.add(score.getAsDouble());
            }
        }
        if (scores.isEmpty()) {
            return EMPTY;
        }

        List<ScoreDomain> detected = new ArrayList<>();
        Iterator<Double> iterator = scores.iterator();
        double rangeStart = iterator.next();
        double previous = rangeStart;
        while (iterator.hasNext()) {
            double current = iterator.next();
            if (current - previous > gapThreshold) {
                detected.add(rangeDomain(rangeStart, previous));
                rangeStart = current;
            }
            previous = current;
        }
        detected.add(rangeDomain(rangeStart, previous));
        return new ScoreDomainRegistry(detected);
    }

    private static ScoreDomain rangeDomain(double min, double max) {
        String name = "Score Range " + CellValues.formatNumber(min) + "-" + CellValues.formatNumber(max);
        return new ScoreDomain(name, min, max, "Detected from data");
    }

    public List<ScoreDomain> domains() {
        return domains;
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    public Optional<ScoreDomain> find(String name) {
        return domains.stream().filter(domain -> domain.name().equals(name)).findFirst();
    }
}
