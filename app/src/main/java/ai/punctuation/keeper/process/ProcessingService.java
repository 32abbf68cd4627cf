package ai.punctuation.keeper.process;

import ai.punctuation.keeper.preserve.PreservedText;
import ai.punctuation.keeper.preserve.PunctuationPreserver;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs lines through a {@link ChunkProcessor} while keeping their punctuation out of its way.
 */
public class ProcessingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingService.class);

    private final ChunkProcessorFactory processorFactory;
    private final PunctuationPreserver preserver;
    private final int maxRetryAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public ProcessingService(ChunkProcessorFactory processorFactory, PunctuationPreserver preserver) {
        this(processorFactory, preserver, 4, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public ProcessingService(ChunkProcessorFactory processorFactory, PunctuationPreserver preserver,
                             int maxRetryAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.processorFactory = Objects.requireNonNull(processorFactory, "processorFactory");
        this.preserver = Objects.requireNonNull(preserver, "preserver");
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
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public ProcessingResult process(List<String> lines, PunctuationMode punctuationMode, ProcessingMode processingMode) {
        Objects.requireNonNull(punctuationMode, "punctuationMode");
        Objects.requireNonNull(processingMode, "processingMode");
        if (lines == null || lines.isEmpty()) {
            return ProcessingResult.empty();
        }
        ChunkProcessor processor = processorFactory.select(processingMode);
        LOGGER.info("Processing {} lines ({} punctuation, {} processor)", lines.size(), punctuationMode, processingMode);
        return switch (punctuationMode) {
            case PRESERVE -> preserveAndProcess(lines, processor);
            case REMOVE -> removeAndProcess(lines, processor);
        };
    }

    private ProcessingResult removeAndProcess(List<String> lines, ChunkProcessor processor) {
        Map<Integer, String> blankLines = new LinkedHashMap<>();
        List<String> stripped = setAsideBlankLines(preserver.remove(lines), blankLines);
        List<String> processed = processWithRetry(processor, stripped);
        boolean aligned = processed.size() == stripped.size();
        if (!aligned) {
            LOGGER.warn("Processor returned {} lines for {} stripped lines", processed.size(), stripped.size());
        }
        return new ProcessingResult(reinsertBlankLines(processed, blankLines, stripped.size()),
                stripped.size(), 0, aligned);
    }

    private ProcessingResult preserveAndProcess(List<String> lines, ChunkProcessor processor) {
        // blank lines yield no mark and must not reach the processor, so they are put back by position afterwards
        Map<Integer, String> blankLines = new LinkedHashMap<>();
        List<String> contentLines = setAsideBlankLines(lines, blankLines);

        PreservedText preserved = preserver.preserve(contentLines);
        LOGGER.debug("Preserved {} chunks and {} marks", preserved.chunkCount(), preserved.markCount());

        List<String> processed = processWithRetry(processor, preserved.chunks());
        if (processed.isEmpty() && preserved.chunkCount() > 0) {
            LOGGER.warn("Processor returned no output for {} chunks; falling back to unprocessed chunks", preserved.chunkCount());
            processed = preserved.chunks();
        }
        boolean aligned = processed.size() == preserved.chunkCount();
        if (!aligned) {
            LOGGER.warn("Processor returned {} chunks, expected {}; punctuation restoration may be lossy",
                    processed.size(), preserved.chunkCount());
        }

        List<String> restored = preserver.restore(processed, preserved.marks());
        return new ProcessingResult(reinsertBlankLines(restored, blankLines, contentLines.size()),
                preserved.chunkCount(), preserved.markCount(), aligned);
    }

    private static List<String> setAsideBlankLines(List<String> lines, Map<Integer, String> blankLines) {
        List<String> contentLines = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = Objects.requireNonNull(lines.get(i), "line");
            if (line.isBlank()) {
                blankLines.put(i, line);
            } else {
                contentLines.add(line);
            }
        }
        return contentLines;
    }

    private List<String> reinsertBlankLines(List<String> restored, Map<Integer, String> blankLines, int contentLineCount) {
        if (blankLines.isEmpty()) {
            return restored;
        }
        if (restored.size() != contentLineCount) {
            LOGGER.warn("Restored {} lines, expected {}; dropping {} blank lines",
                    restored.size(), contentLineCount, blankLines.size());
            return restored;
        }
        List<String> result = new ArrayList<>(restored);
        // indexes were collected in ascending order
        for (Map.Entry<Integer, String> blankLine : blankLines.entrySet()) {
            result.add(blankLine.getKey(), blankLine.getValue());
        }
        return result;
    }

    private List<String> processWithRetry(ChunkProcessor processor, List<String> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }
        for (int attempt = 0; ; attempt++) {
            try {
                List<String> processed = processor.process(chunks);
                return processed == null ? List.of() : processed;
            } catch (RuntimeException ex) {
                if (!isRateLimitError(ex) || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Processing rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex instanceof ProcessingException processingException
                            ? processingException
                            : new ProcessingException("Chunk processing failed", ex);
                }
                Duration delay = backoff(attempt);
                LOGGER.warn("Processing rate limited; retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, maxRetryAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    throw new ProcessingException("Processing retry interrupted", ex);
                }
            }
        }
    }

    private Duration backoff(int attempt) {
        Duration delay = initialBackoff.multipliedBy(1L << Math.min(attempt, 20));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
