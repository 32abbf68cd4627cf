package ai.punctuation.keeper.config;

import ai.punctuation.keeper.mark.MarkMatcher;
import ai.punctuation.keeper.process.ProcessingMode;
import ai.punctuation.keeper.process.PunctuationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        PunctuationMode punctuationMode,
        MarkMatcher markMatcher,
        ProcessingMode processingMode,
        Optional<Path> input,
        Optional<Path> output,
        LogFormat logFormat,
        ProcessorConfig processorConfig,
        int maxRetryAttempts,
        Duration initialBackoff,
        Duration maxBackoff
) {

    public Config {
        Objects.requireNonNull(punctuationMode, "punctuationMode");
        Objects.requireNonNull(markMatcher, "markMatcher");
        Objects.requireNonNull(processingMode, "processingMode");
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        Objects.requireNonNull(processorConfig, "processorConfig");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (input.isPresent() && output.isPresent()
                && input.get().toAbsolutePath().normalize().equals(output.get().toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("--output must differ from --input");
        }
    }
}
