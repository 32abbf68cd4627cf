package ai.punctuation.keeper.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.punctuation.keeper.cli.CliArguments;
import ai.punctuation.keeper.mark.InvalidConfigurationException;
import ai.punctuation.keeper.mark.Punctuation;
import ai.punctuation.keeper.process.ProcessingMode;
import ai.punctuation.keeper.process.PunctuationMode;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "in.txt",
                "--output", "out/result.txt",
                "--punctuation", "remove",
                "--marks", ",,!",
                "--processing-mode", "mock",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.punctuationMode()).isEqualTo(PunctuationMode.REMOVE);
        assertThat(config.markMatcher().marks()).isEqualTo(",!");
        assertThat(config.processingMode()).isEqualTo(ProcessingMode.MOCK);
        assertThat(config.input()).contains(Path.of("in.txt"));
        assertThat(config.output()).contains(Path.of("out/result.txt"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.processorConfig().modelName()).isEqualTo("llama3.1");
        assertThat(config.processorConfig().baseUrl()).isEqualTo(URI.create("http://localhost:11434"));
        assertThat(config.maxRetryAttempts()).isEqualTo(4);
        assertThat(config.initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.maxBackoff()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_PUNCTUATION_MODE, "remove");
        envValues.put(ConfigLoader.ENV_PUNCTUATION_MARKS, "?!");
        envValues.put(ConfigLoader.ENV_PROCESSING_MODE, "dry_run");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "qwen2.5");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_LLM_INSTRUCTION, "Rewrite each line politely.");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "2");
        envValues.put(ConfigLoader.ENV_LLM_INITIAL_BACKOFF_MILLIS, "250");
        envValues.put(ConfigLoader.ENV_LLM_MAX_BACKOFF_MILLIS, "500");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.punctuationMode()).isEqualTo(PunctuationMode.REMOVE);
        assertThat(config.markMatcher().marks()).isEqualTo("?!");
        assertThat(config.processingMode()).isEqualTo(ProcessingMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.input()).isEmpty();
        assertThat(config.output()).isEmpty();
        assertThat(config.processorConfig().modelName()).isEqualTo("qwen2.5");
        assertThat(config.processorConfig().baseUrl()).isEqualTo(URI.create("http://ollama:11434"));
        assertThat(config.processorConfig().instruction()).isEqualTo("Rewrite each line politely.");
        assertThat(config.maxRetryAttempts()).isEqualTo(2);
        assertThat(config.initialBackoff()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.maxBackoff()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void usesDefaultsWithoutArgumentsOrEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.punctuationMode()).isEqualTo(PunctuationMode.PRESERVE);
        assertThat(config.markMatcher().marks()).isEqualTo(Punctuation.DEFAULT_MARKS);
        assertThat(config.processingMode()).isEqualTo(ProcessingMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void dryRunFlagOverridesEnvironmentProcessingMode() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--dry-run");

        Config config = new ConfigLoader(key -> ConfigLoader.ENV_PROCESSING_MODE.equals(key)
                ? Optional.of("production")
                : Optional.empty()).load(cliArguments);

        assertThat(config.processingMode()).isEqualTo(ProcessingMode.DRY_RUN);
    }

    @Test
    void emptyMarksAreRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--marks", "");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void invalidRetrySettingCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS.equals(key)
                ? Optional.of("many")
                : Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS);
    }

    @Test
    void retryAttemptsOutsideIntRangeAreRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        for (String rawValue : List.of("0", "-1", "2147483648", "4294967297")) {
            Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS.equals(key)
                    ? Optional.of(rawValue)
                    : Optional.empty()).load(cliArguments));

            assertThat(thrown)
                    .as("LLM_MAX_RETRY_ATTEMPTS=%s", rawValue)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS);
        }
    }

    @Test
    void zeroInitialBackoffIsRejectedWithEnvironmentKey() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_LLM_INITIAL_BACKOFF_MILLIS.equals(key)
                ? Optional.of("0")
                : Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LLM_INITIAL_BACKOFF_MILLIS);
    }

    @Test
    void maxBackoffBelowInitialBackoffIsRejectedWithEnvironmentKey() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_LLM_MAX_BACKOFF_MILLIS.equals(key)
                ? Optional.of("10")
                : Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LLM_MAX_BACKOFF_MILLIS);
    }

    @Test
    void sameInputAndOutputCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "doc.txt", "--output", "./doc.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--output");
    }
}
