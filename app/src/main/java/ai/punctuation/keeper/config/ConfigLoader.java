package ai.punctuation.keeper.config;

import ai.punctuation.keeper.cli.CliArguments;
import ai.punctuation.keeper.mark.MarkMatcher;
import ai.punctuation.keeper.mark.Punctuation;
import ai.punctuation.keeper.process.ProcessingMode;
import ai.punctuation.keeper.process.PunctuationMode;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PUNCTUATION_MODE = "PUNCTUATION_MODE";
    static final String ENV_PUNCTUATION_MARKS = "PUNCTUATION_MARKS";
    static final String ENV_PROCESSING_MODE = "PROCESSING_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_INSTRUCTION = "LLM_INSTRUCTION";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_MILLIS = "LLM_INITIAL_BACKOFF_MILLIS";
    static final String ENV_LLM_MAX_BACKOFF_MILLIS = "LLM_MAX_BACKOFF_MILLIS";

    private static final String DEFAULT_MODEL = "llama3.1";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_INSTRUCTION = "Translate each of the following lines into natural Japanese.";
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 4;
    private static final long DEFAULT_LLM_INITIAL_BACKOFF_MILLIS = 1_000;
    private static final long DEFAULT_LLM_MAX_BACKOFF_MILLIS = 30_000;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        PunctuationMode punctuationMode = resolvePunctuationMode(arguments);
        MarkMatcher markMatcher = Punctuation.configure(resolveMarks(arguments));
        ProcessingMode processingMode = resolveProcessingMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(DEFAULT_MODEL);
        URI baseUrl = environmentReader.get(ENV_OLLAMA_BASE_URL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(URI::create)
                .orElse(URI.create(DEFAULT_OLLAMA_BASE_URL));
        String instruction = environmentReader.get(ENV_LLM_INSTRUCTION)
                .filter(ConfigLoader::isNotBlank)
                .orElse(DEFAULT_INSTRUCTION);

        int maxRetryAttempts = Math.toIntExact(readInRange(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS, 1, Integer.MAX_VALUE));
        long initialBackoffMillis = readInRange(ENV_LLM_INITIAL_BACKOFF_MILLIS, DEFAULT_LLM_INITIAL_BACKOFF_MILLIS, 1, Long.MAX_VALUE);
        long maxBackoffMillis = readInRange(ENV_LLM_MAX_BACKOFF_MILLIS, DEFAULT_LLM_MAX_BACKOFF_MILLIS, 1, Long.MAX_VALUE);
        if (maxBackoffMillis < initialBackoffMillis) {
            throw new IllegalArgumentException(ENV_LLM_MAX_BACKOFF_MILLIS + " must not be lower than " + ENV_LLM_INITIAL_BACKOFF_MILLIS);
        }
        Duration initialBackoff = Duration.ofMillis(initialBackoffMillis);
        Duration maxBackoff = Duration.ofMillis(maxBackoffMillis);

        return new Config(punctuationMode, markMatcher, processingMode,
                Optional.ofNullable(arguments.input()), Optional.ofNullable(arguments.output()), logFormat,
                new ProcessorConfig(modelName, baseUrl, instruction),
                maxRetryAttempts, initialBackoff, maxBackoff);
    }

    private PunctuationMode resolvePunctuationMode(CliArguments arguments) {
        PunctuationMode cliMode = arguments.punctuationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_PUNCTUATION_MODE)
                .map(PunctuationMode::from)
                .orElse(PunctuationMode.PRESERVE);
    }

    private String resolveMarks(CliArguments arguments) {
        // an empty --marks value is kept so that it fails as an invalid mark set
        if (arguments.marks() != null) {
            return arguments.marks();
        }
        return environmentReader.get(ENV_PUNCTUATION_MARKS)
                .filter(value -> !value.isEmpty())
                .orElse(Punctuation.DEFAULT_MARKS);
    }

    private ProcessingMode resolveProcessingMode(CliArguments arguments) {
        ProcessingMode cliMode = arguments.processingMode();
        if (cliMode != null) {
            return cliMode;
        }
        if (arguments.dryRun()) {
            return ProcessingMode.DRY_RUN;
        }
        return environmentReader.get(ENV_PROCESSING_MODE)
                .map(ProcessingMode::from)
                .orElse(ProcessingMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private long readInRange(String envKey, long defaultValue, long minimum, long maximum) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseInRange(raw, envKey, minimum, maximum))
                .orElse(defaultValue);
    }

    private static long parseInRange(String raw, String envKey, long minimum, long maximum) {
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer between " + minimum + " and " + maximum, ex);
        }
        if (value < minimum || value > maximum) {
            throw new IllegalArgumentException(envKey + " must be an integer between " + minimum + " and " + maximum);
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
