package ai.punctuation.keeper.cli;

import ai.punctuation.keeper.config.LogFormat;
import ai.punctuation.keeper.process.ProcessingMode;
import ai.punctuation.keeper.process.PunctuationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "punctuation-keeper", mixinStandardHelpOptions = true, version = "punctuation-keeper 0.1.0",
        description = "Runs text through a chunk processor while keeping punctuation out of its way")
public class CliArguments {

    @CommandLine.Option(names = {"-i", "--input"}, description = "Input file, one utterance per line (default: standard input)", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (default: standard output)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = {"-p", "--punctuation"}, converter = PunctuationModeConverter.class,
            description = "What to do with punctuation: preserve or remove")
    private PunctuationMode punctuationMode;

    @CommandLine.Option(names = "--marks", description = "Punctuation marks to consider, each a single character", paramLabel = "MARKS")
    private String marks;

    @CommandLine.Option(names = "--processing-mode", converter = ProcessingModeConverter.class,
            description = "Chunk processor: production, dry-run, or mock")
    private ProcessingMode processingMode;

    @CommandLine.Option(names = "--dry-run", description = "Pass chunks through unchanged instead of calling the model")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public PunctuationMode punctuationMode() {
        return punctuationMode;
    }

    public String marks() {
        return marks;
    }

    public ProcessingMode processingMode() {
        return processingMode;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
