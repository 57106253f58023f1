package ai.doctables.reconstructor.engine;

import ai.doctables.reconstructor.io.FragmentDocumentReader;
import ai.doctables.reconstructor.io.ReportJsonWriter;
import ai.doctables.reconstructor.model.FragmentDocument;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs documents one after another. A document that fails is recorded and the batch moves on.
 */
public class BatchReconstructionService {

    static final String MDC_DOCUMENT = "document";

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchReconstructionService.class);

    private final TableReconstructionEngine engine;
    private final FragmentDocumentReader reader;
    private final ReportJsonWriter writer;
    private final Optional<Path> outputDirectory;
    private final Clock clock;

    public BatchReconstructionService(TableReconstructionEngine engine,
                                      FragmentDocumentReader reader,
                                      ReportJsonWriter writer,
                                      Optional<Path> outputDirectory) {
        this(engine, reader, writer, outputDirectory, Clock.systemUTC());
    }

    BatchReconstructionService(TableReconstructionEngine engine,
                               FragmentDocumentReader reader,
                               ReportJsonWriter writer,
                               Optional<Path> outputDirectory,
                               Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<DocumentOutcome> run(List<Path> inputs) {
        List<DocumentOutcome> outcomes = new ArrayList<>(inputs.size());
        for (Path input : inputs) {
            outcomes.add(process(input));
        }
        long failed = outcomes.stream().filter(outcome -> !outcome.success()).count();
        LOGGER.info("Batch finished: {} documents, {} failed", outcomes.size(), failed);
        return outcomes;
    }

    private DocumentOutcome process(Path input) {
        String documentName = FragmentDocumentReader.documentName(input);
        Instant started = clock.instant();
        MDC.put(MDC_DOCUMENT, documentName);
        try {
            FragmentDocument document = reader.read(input);
            ReconstructionResult result = engine.reconstruct(document);
            outputDirectory.ifPresent(directory -> {
                Path written = writer.write(result, directory);
                LOGGER.info("Wrote report {}", written);
            });
            return DocumentOutcome.succeeded(result, Duration.between(started, clock.instant()));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to reconstruct {}", input, ex);
            return DocumentOutcome.failed(documentName, ex.getMessage(), Duration.between(started, clock.instant()));
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }
}
