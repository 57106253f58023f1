package ai.doctables.reconstructor.cli;

import ai.doctables.reconstructor.config.LogFormat;
import ai.doctables.reconstructor.engine.ExtractionMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "table-reconstructor", mixinStandardHelpOptions = true, version = "table-reconstructor 1.0.0",
        description = "Reconstructs logical tables from page-tagged fragments and validates them")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Fragment hand-off JSON files")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--strategy", paramLabel = "STRATEGY",
            description = "Segmentation strategy: score_domain, header_repetition or auto")
    private String strategy;

    @CommandLine.Option(names = "--extraction-mode", converter = ExtractionModeConverter.class, paramLabel = "MODE",
            description = "Tables to validate and report: hybrid, page_only or logical_only")
    private ExtractionMode extractionMode;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class,
            description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--tolerance", paramLabel = "FRACTION",
            description = "Allowed deviation of percent totals, as a fraction of 100")
    private Double tolerance;

    @CommandLine.Option(names = "--no-validation", description = "Skip the validation rule chain")
    private boolean noValidation;

    @CommandLine.Option(names = "--min-profile-confidence", paramLabel = "CONFIDENCE",
            description = "Minimum confidence for a document profile to be applied")
    private Double minProfileConfidence;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "DIR",
            description = "Directory receiving one reconstruction JSON per document")
    private Path outputDirectory;

    public List<Path> inputs() {
        return inputs;
    }

    public String strategy() {
        return strategy;
    }

    public ExtractionMode extractionMode() {
        return extractionMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Double tolerance() {
        return tolerance;
    }

    public boolean noValidation() {
        return noValidation;
    }

    public Double minProfileConfidence() {
        return minProfileConfidence;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }
}
