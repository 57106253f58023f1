package ai.doctables.reconstructor.profile;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.segment.CellValues;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Examination marks-distribution reports (TASS/CASS statistics). Their score ranges routinely span
 * page breaks, so they are segmented by score domain.
 */
public class MarksDistributionProfile implements DocumentProfile {

    static final String ID = "waec_marks_distribution";
    static final String VERSION = "1.0.0";

    private static final List<String> INDICATORS = List.of("WAEC", "WEST AFRICAN EXAMINATIONS COUNCIL", "TASS", "CASS");
    private static final List<String> DISTRIBUTION_KEYWORDS = List.of("FREQUENCY", "PERCENT", "CUMULATIVE", "SCORE");
    private static final double NUMERIC_COLUMN_RATIO = 0.7;
    private static final String ORGANIZATION = "West African Examinations Council (WAEC)";

    private static final Pattern SUBJECT = Pattern.compile("SUBJECT[:\\s]+([A-Z\\s]+)");
    private static final Pattern SUBJECT_LINE = Pattern.compile("SUBJECT[:\\s]+([A-Z\\s]+?)(?:\\s{2,}|\\n|$)");
    private static final Pattern SESSION = Pattern.compile("(?:SESSION|YEAR)[:\\s]+(\\d{4})");
    private static final Pattern TITLE = Pattern.compile("(TASS|CASS)\\s+(?:AND\\s+)?(TASS|CASS)?\\s*.*?STATISTICS",
            Pattern.CASE_INSENSITIVE);

    private static final List<ScoreDomain> DOMAINS = List.of(
            new ScoreDomain("Scaled_Objective", 0, 19, "Scaled Objective score range (0-19)"),
            new ScoreDomain("Scaled_Essay", 15, 40, "Scaled Essay score range (15-40)"),
            new ScoreDomain("Raw_Score_40", 0, 40, "Raw score range (0-40)"),
            new ScoreDomain("Raw_Score_50", 0, 50, "Raw score range (0-50)"),
            new ScoreDomain("Raw_Score_60", 0, 60, "Raw score range (0-60)"));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public ProfileDetection detect(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context) {
        double confidence = 0.0;
        Map<String, Object> metadata = new LinkedHashMap<>();
        String fullText = ProfileText.joinUpper(pageTexts);

        int indicatorMatches = ProfileText.countIndicators(fullText, INDICATORS);
        if (indicatorMatches > 0) {
            confidence += 0.3 * Math.min(indicatorMatches, 2);
        }
        if (ProfileText.countHeaderKeywords(fragments, DISTRIBUTION_KEYWORDS) >= 3) {
            confidence += 0.4;
        }
        if (fragments.stream().anyMatch(MarksDistributionProfile::hasNumericFirstColumn)) {
            confidence += 0.3;
        }

        ProfileText.group(SUBJECT, fullText, 1).ifPresent(subject -> metadata.put("subject", subject));
        ProfileText.group(SESSION, fullText, 1).ifPresent(session -> metadata.put("session", session));
        if (fullText.contains("ESSAY")) {
            metadata.put("paper_type", "essay");
        } else if (fullText.contains("OBJECTIVE")) {
            metadata.put("paper_type", "objective");
        }
        return new ProfileDetection(ID, Math.min(confidence, 1.0), metadata);
    }

    private static boolean hasNumericFirstColumn(Fragment fragment) {
        List<List<String>> rows = fragment.data();
        if (rows.size() <= 1) {
            return false;
        }
        long numeric = rows.subList(1, rows.size()).stream()
                .filter(row -> !row.isEmpty() && CellValues.isNumeric(row.get(0)))
                .count();
        return numeric > (rows.size() - 1) * NUMERIC_COLUMN_RATIO;
    }

    @Override
    public SegmentationStrategy segmentationStrategy() {
        return SegmentationStrategy.SCORE_DOMAIN;
    }

    @Override
    public Optional<List<ScoreDomain>> scoreDomains() {
        return Optional.of(DOMAINS);
    }

    @Override
    public DocumentMetadata extractMetadata(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context) {
        String fullText = ProfileText.join(pageTexts);
        String title = ProfileText.group(TITLE, fullText, 0).orElse("WAEC Marks Distribution");
        return new DocumentMetadata(Optional.of(title),
                Optional.of(ORGANIZATION),
                ProfileText.group(SESSION, fullText, 1),
                ProfileText.group(SUBJECT_LINE, fullText, 1),
                Optional.of(ID),
                Optional.of(VERSION),
                0.0);
    }

    @Override
    public Optional<String> summarize(List<LogicalTable> tables) {
        String lines = tables.stream()
                .filter(table -> table.scoreDomain().isPresent())
                .map(table -> "- " + table.scoreDomain().get().name() + ": " + (table.rowCount() - 1) + " score entries")
                .collect(Collectors.joining("\n"));
        return lines.isEmpty() ? Optional.empty() : Optional.of("WAEC Marks Distribution Summary:\n" + lines);
    }
}
