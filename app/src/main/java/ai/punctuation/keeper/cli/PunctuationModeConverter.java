package ai.punctuation.keeper.cli;

import ai.punctuation.keeper.process.PunctuationMode;
import picocli.CommandLine;

public class PunctuationModeConverter implements CommandLine.ITypeConverter<PunctuationMode> {

    @Override
    public PunctuationMode convert(String value) {
        return PunctuationMode.from(value);
    }
}
