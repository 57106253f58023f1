package ai.doctables.reconstructor.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.doctables.reconstructor.config.Config;
import ai.doctables.reconstructor.config.ConfigLoader;
import ai.doctables.reconstructor.engine.BatchReconstructionService;
import ai.doctables.reconstructor.engine.TableReconstructionEngine;
import ai.doctables.reconstructor.io.FragmentDocumentReader;
import ai.doctables.reconstructor.io.ReportJsonWriter;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path workDir;

    private final List<Config> loadedConfigs = new ArrayList<>();

    @Test
    void returnsZeroWhenEveryDocumentPasses() throws URISyntaxException {
        int exitCode = application().run(new String[] {fixture("staff_list.json")});

        assertThat(exitCode).isZero();
        assertThat(loadedConfigs).hasSize(1);
    }

    @Test
    void returnsValidationCodeWhenReportFails() throws URISyntaxException {
        int exitCode = application().run(new String[] {fixture("marks_distribution.json")});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_VALIDATION_FAILED);
    }

    @Test
    void skippingValidationPassesTheSameDocument() throws URISyntaxException {
        int exitCode = application().run(new String[] {"--no-validation", fixture("marks_distribution.json")});

        assertThat(exitCode).isZero();
        assertThat(loadedConfigs.get(0).validationEnabled()).isFalse();
    }

    @Test
    void documentFailureTakesPrecedence() throws IOException, URISyntaxException {
        Path broken = Files.writeString(workDir.resolve("broken.json"), "not json");
        Path output = workDir.resolve("out");

        int exitCode = application().run(new String[] {
                "-o", output.toString(),
                broken.toString(),
                fixture("staff_list.json")
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_DOCUMENT_FAILED);
        assertThat(output.resolve("staff_list.reconstruction.json")).exists();
    }

    @Test
    void invalidArgumentsUsePicocliCode() {
        assertThat(application().run(new String[0])).isEqualTo(2);
        assertThat(application().run(new String[] {"--strategy", "columns", "doc.json"})).isEqualTo(2);
        assertThat(application().run(new String[] {"--extraction-mode", "everything", "doc.json"})).isEqualTo(2);
        assertThat(loadedConfigs).isEmpty();
    }

    @Test
    void helpDoesNotRunTheBatch() {
        assertThat(application().run(new String[] {"--help"})).isZero();
        assertThat(loadedConfigs).isEmpty();
    }

    private CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), config -> {
            loadedConfigs.add(config);
            return new BatchReconstructionService(new TableReconstructionEngine(config), new FragmentDocumentReader(),
                    new ReportJsonWriter(), config.outputDirectory());
        });
    }

    private String fixture(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/fixtures/" + name).toURI()).toString();
    }
}
