package ai.doctables.reconstructor.cli;

import ai.doctables.reconstructor.engine.ExtractionMode;
import picocli.CommandLine;

public class ExtractionModeConverter implements CommandLine.ITypeConverter<ExtractionMode> {
    @Override
    public ExtractionMode convert(String value) {
        return ExtractionMode.from(value);
    }
}
