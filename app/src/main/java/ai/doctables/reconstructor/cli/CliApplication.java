package ai.doctables.reconstructor.cli;

import ai.doctables.reconstructor.config.Config;
import ai.doctables.reconstructor.config.ConfigLoader;
import ai.doctables.reconstructor.config.SystemEnvironmentReader;
import ai.doctables.reconstructor.engine.BatchReconstructionService;
import ai.doctables.reconstructor.engine.DocumentOutcome;
import ai.doctables.reconstructor.engine.ReconstructionResult;
import ai.doctables.reconstructor.engine.TableReconstructionEngine;
import ai.doctables.reconstructor.io.FragmentDocumentReader;
import ai.doctables.reconstructor.io.ReportJsonWriter;
import ai.doctables.reconstructor.logging.LoggingConfigurator;
import ai.doctables.reconstructor.segment.SegmentationException;
import ai.doctables.reconstructor.validate.ValidationReport;
import ai.doctables.reconstructor.validate.ValidationStatus;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch runner.
 */
public final class CliApplication {

    static final int EXIT_DOCUMENT_FAILED = 1;
    static final int EXIT_VALIDATION_FAILED = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, BatchReconstructionService> serviceFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createService);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, BatchReconstructionService> serviceFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | SegmentationException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Reconstructing {} documents (mode={}, strategy={}, validation={})",
                config.inputs().size(), config.extractionMode().tag(),
                config.strategy().map(strategy -> strategy.tag()).orElse("auto"), config.validationEnabled());

        List<DocumentOutcome> outcomes = serviceFactory.apply(config).run(config.inputs());
        boolean anyDocumentFailed = false;
        boolean anyValidationFailed = false;
        for (DocumentOutcome outcome : outcomes) {
            if (!outcome.success()) {
                anyDocumentFailed = true;
                LOGGER.warn("{} failed after {} ms: {}", outcome.documentName(),
                        outcome.processingTime().toMillis(), outcome.errorMessage().orElse("unknown error"));
                continue;
            }
            ReconstructionResult result = outcome.result().orElseThrow();
            ValidationReport report = result.report();
            anyValidationFailed |= report.overallStatus() == ValidationStatus.FAILED;
            LOGGER.info("{}: {} tables, validation {} ({} issues) in {} ms", outcome.documentName(),
                    result.routedTables().size(), report.overallStatus().label(), report.issues().size(),
                    outcome.processingTime().toMillis());
            result.summary().ifPresent(summary -> LOGGER.info("{}", summary));
        }
        if (anyDocumentFailed) {
            return EXIT_DOCUMENT_FAILED;
        }
        return anyValidationFailed ? EXIT_VALIDATION_FAILED : 0;
    }

    private static BatchReconstructionService createService(Config config) {
        return new BatchReconstructionService(new TableReconstructionEngine(config), new FragmentDocumentReader(),
                new ReportJsonWriter(), config.outputDirectory());
    }
}
