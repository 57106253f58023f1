package ai.doctables.reconstructor.profile;

import ai.doctables.reconstructor.config.SegmentationSettings;
import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.segment.HeaderRepetitionSegmenter;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Staff rosters that repeat their column header on every page and group people under
 * department title rows.
 */
public class StaffListProfile implements DocumentProfile {

    static final String ID = "international_staff_list";
    static final String VERSION = "1.0.0";

    private static final List<String> INDICATORS = List.of("STAFF LIST", "STAFF ROSTER", "INTERNATIONAL STAFF", "PERSONNEL");
    private static final List<String> ROSTER_KEYWORDS = List.of("NAME", "POSITION", "DEPARTMENT", "NATIONALITY");

    private static final Pattern YEAR = Pattern.compile("\\b(20\\d{2})\\b");
    private static final Pattern TITLE = Pattern.compile("(INTERNATIONAL\\s+STAFF\\s+LIST.*?(?:\\d{4})?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ORGANIZATION = Pattern.compile(
            "(?:SCHOOL|COLLEGE|UNIVERSITY|ORGANIZATION)[: \\t]+([A-Z &]+)", Pattern.CASE_INSENSITIVE);

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
        if (ProfileText.countHeaderKeywords(fragments, ROSTER_KEYWORDS) >= 2) {
            confidence += 0.3;
        }

        List<List<String>> allRows = new ArrayList<>();
        fragments.forEach(fragment -> allRows.addAll(fragment.data()));
        Optional<List<String>> repeatedHeader = HeaderRepetitionSegmenter.findRepeatedHeader(allRows,
                SegmentationSettings.DEFAULT_HEADER_REPEAT_MINIMUM);
        if (repeatedHeader.isPresent()) {
            confidence += 0.4;
            metadata.put("header_pattern", repeatedHeader.get());
        }

        ProfileText.group(YEAR, fullText, 1).ifPresent(year -> metadata.put("year", year));
        return new ProfileDetection(ID, Math.min(confidence, 1.0), metadata);
    }

    @Override
    public SegmentationStrategy segmentationStrategy() {
        return SegmentationStrategy.HEADER_REPETITION;
    }

    @Override
    public DocumentMetadata extractMetadata(List<Fragment> fragments, List<String> pageTexts, Map<String, Object> context) {
        String fullText = ProfileText.join(pageTexts);
        return new DocumentMetadata(
                Optional.of(ProfileText.group(TITLE, fullText, 1).orElse("International Staff List")),
                ProfileText.group(ORGANIZATION, fullText, 1),
                ProfileText.group(YEAR, fullText, 1),
                Optional.empty(),
                Optional.of(ID),
                Optional.of(VERSION),
                0.0);
    }

    @Override
    public Optional<String> summarize(List<LogicalTable> tables) {
        if (tables.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder sections = new StringBuilder();
        int totalStaff = 0;
        for (LogicalTable table : tables) {
            int count = table.rowCount() - 1;
            totalStaff += count;
            sections.append("\n- ").append(table.sectionTitle().orElse("General"))
                    .append(": ").append(count).append(" staff members");
        }
        return Optional.of("International Staff List Summary:\nTotal Staff: " + totalStaff
                + "\n\nBy Section:" + sections);
    }
}
