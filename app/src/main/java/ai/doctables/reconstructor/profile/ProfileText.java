package ai.doctables.reconstructor.profile;

import ai.doctables.reconstructor.model.Fragment;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text probes shared by the built-in profiles.
 */
final class ProfileText {

    private ProfileText() {
    }

    static String join(List<String> pageTexts) {
        return String.join("\n", pageTexts);
    }

    static String joinUpper(List<String> pageTexts) {
        return join(pageTexts).toUpperCase(Locale.ROOT);
    }

    static int countIndicators(String upperText, List<String> indicators) {
        return (int) indicators.stream().filter(upperText::contains).count();
    }

    /**
     * Sums, over all fragments, how many of the keywords occur in the fragment's first row.
     */
    static int countHeaderKeywords(List<Fragment> fragments, List<String> keywords) {
        int count = 0;
        for (Fragment fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            String firstRow = String.join(" ", fragment.data().get(0)).toUpperCase(Locale.ROOT);
            count += countIndicators(firstRow, keywords);
        }
        return count;
    }

    static Optional<String> group(Pattern pattern, String text, int group) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(group);
        return value == null ? Optional.empty() : Optional.of(value.trim());
    }
}
