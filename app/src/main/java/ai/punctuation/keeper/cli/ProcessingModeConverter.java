package ai.punctuation.keeper.cli;

import ai.punctuation.keeper.process.ProcessingMode;
import picocli.CommandLine;

public class ProcessingModeConverter implements CommandLine.ITypeConverter<ProcessingMode> {

    @Override
    public ProcessingMode convert(String value) {
        return ProcessingMode.from(value);
    }
}
