package ai.doctables.reconstructor.config;

import ai.doctables.reconstructor.engine.ExtractionMode;
import ai.doctables.reconstructor.profile.ProfileRegistry;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        List<Path> inputs,
        Optional<Path> outputDirectory,
        Optional<SegmentationStrategy> strategy,
        ExtractionMode extractionMode,
        LogFormat logFormat,
        boolean validationEnabled,
        SegmentationSettings segmentationSettings,
        ValidationSettings validationSettings,
        double minProfileConfidence
) {

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        strategy = strategy == null ? Optional.empty() : strategy;
        extractionMode = Objects.requireNonNull(extractionMode, "extractionMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        segmentationSettings = Objects.requireNonNull(segmentationSettings, "segmentationSettings");
        validationSettings = Objects.requireNonNull(validationSettings, "validationSettings");
        if (Double.isNaN(minProfileConfidence) || minProfileConfidence < 0.0 || minProfileConfidence > 1.0) {
            throw new IllegalArgumentException("minProfileConfidence must be within [0, 1]");
        }
    }

    /**
     * Defaults for embedding the engine without a command line.
     */
    public static Config defaults() {
        return new Config(List.of(), Optional.empty(), Optional.empty(), ExtractionMode.HYBRID, LogFormat.TEXT, true,
                SegmentationSettings.defaults(), ValidationSettings.defaults(), ProfileRegistry.DEFAULT_MIN_CONFIDENCE);
    }
}
