package ai.doctables.reconstructor.config;

import ai.doctables.reconstructor.cli.CliArguments;
import ai.doctables.reconstructor.engine.ExtractionMode;
import ai.doctables.reconstructor.profile.ProfileRegistry;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} from CLI arguments, then environment variables, then defaults.
 */
public class ConfigLoader {

    static final String ENV_SEGMENTATION_STRATEGY = "SEGMENTATION_STRATEGY";
    static final String ENV_EXTRACTION_MODE = "EXTRACTION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VALIDATION_ENABLED = "VALIDATION_ENABLED";
    static final String ENV_VALIDATION_TOLERANCE = "VALIDATION_TOLERANCE";
    static final String ENV_DISTRIBUTION_KEYWORD_MINIMUM = "DISTRIBUTION_KEYWORD_MINIMUM";
    static final String ENV_NUMERIC_RATIO_THRESHOLD = "NUMERIC_RATIO_THRESHOLD";
    static final String ENV_DOMAIN_GAP_THRESHOLD = "DOMAIN_GAP_THRESHOLD";
    static final String ENV_HEADER_REPEAT_MINIMUM = "HEADER_REPEAT_MINIMUM";
    static final String ENV_MIN_PROFILE_CONFIDENCE = "MIN_PROFILE_CONFIDENCE";

    private static final String AUTO_STRATEGY = "auto";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        SegmentationSettings segmentationSettings = new SegmentationSettings(
                env(ENV_NUMERIC_RATIO_THRESHOLD).map(value -> parseDouble(ENV_NUMERIC_RATIO_THRESHOLD, value))
                        .orElse(SegmentationSettings.DEFAULT_NUMERIC_RATIO_THRESHOLD),
                env(ENV_DOMAIN_GAP_THRESHOLD).map(value -> parseDouble(ENV_DOMAIN_GAP_THRESHOLD, value))
                        .orElse(SegmentationSettings.DEFAULT_DOMAIN_GAP_THRESHOLD),
                env(ENV_HEADER_REPEAT_MINIMUM).map(value -> parseInteger(ENV_HEADER_REPEAT_MINIMUM, value))
                        .orElse(SegmentationSettings.DEFAULT_HEADER_REPEAT_MINIMUM));

        double tolerance = arguments.tolerance() != null
                ? arguments.tolerance()
                : env(ENV_VALIDATION_TOLERANCE).map(value -> parseDouble(ENV_VALIDATION_TOLERANCE, value))
                .orElse(ValidationSettings.DEFAULT_PERCENT_TOLERANCE);
        ValidationSettings validationSettings = new ValidationSettings(tolerance,
                env(ENV_DISTRIBUTION_KEYWORD_MINIMUM).map(value -> parseInteger(ENV_DISTRIBUTION_KEYWORD_MINIMUM, value))
                        .orElse(ValidationSettings.DEFAULT_DISTRIBUTION_KEYWORD_MINIMUM));

        double minProfileConfidence = arguments.minProfileConfidence() != null
                ? arguments.minProfileConfidence()
                : env(ENV_MIN_PROFILE_CONFIDENCE).map(value -> parseDouble(ENV_MIN_PROFILE_CONFIDENCE, value))
                .orElse(ProfileRegistry.DEFAULT_MIN_CONFIDENCE);

        return new Config(arguments.inputs(),
                Optional.ofNullable(arguments.outputDirectory()),
                resolveStrategy(arguments),
                resolveExtractionMode(arguments),
                resolveLogFormat(arguments),
                resolveValidationEnabled(arguments),
                segmentationSettings,
                validationSettings,
                minProfileConfidence);
    }

    private Optional<SegmentationStrategy> resolveStrategy(CliArguments arguments) {
        Optional<String> raw = Optional.ofNullable(arguments.strategy())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> env(ENV_SEGMENTATION_STRATEGY));
        return raw.map(String::trim)
                .filter(value -> !value.toLowerCase(Locale.ROOT).equals(AUTO_STRATEGY))
                .map(SegmentationStrategy::from);
    }

    private ExtractionMode resolveExtractionMode(CliArguments arguments) {
        ExtractionMode cliMode = arguments.extractionMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_EXTRACTION_MODE)
                .map(ExtractionMode::from)
                .orElse(ExtractionMode.HYBRID);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveValidationEnabled(CliArguments arguments) {
        if (arguments.noValidation()) {
            return false;
        }
        return env(ENV_VALIDATION_ENABLED)
                .map(String::trim)
                .map(value -> !(value.equalsIgnoreCase("false") || value.equals("0")))
                .orElse(true);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key).filter(ConfigLoader::isNotBlank);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }

    private static int parseInteger(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, ex);
        }
    }
}
