package ai.punctuation.keeper.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.punctuation.keeper.mark.Punctuation;
import ai.punctuation.keeper.preserve.PunctuationPreserver;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ProcessingServiceTest {

    private static final PunctuationPreserver PRESERVER = new PunctuationPreserver(Punctuation.configureDefault());

    @Test
    void restoresPunctuationAroundProcessedChunks() {
        ProcessingService service = serviceWith(new PassThroughChunkProcessor());

        ProcessingResult result = service.process(List.of("hello, my world!", "", "¡hola!"),
                PunctuationMode.PRESERVE, ProcessingMode.MOCK);

        assertThat(result.lines()).containsExactly("HELLO, MY WORLD!", "", "¡HOLA!");
        assertThat(result.chunkCount()).isEqualTo(3);
        assertThat(result.markCount()).isEqualTo(4);
        assertThat(result.aligned()).isTrue();
    }

    @Test
    void dryRunReproducesInput() {
        ProcessingService service = serviceWith(new MockChunkProcessor());
        List<String> lines = List.of("Numbers like 3,14 stay.", "", "...", "«Quoted», she said.");

        ProcessingResult result = service.process(lines, PunctuationMode.PRESERVE, ProcessingMode.DRY_RUN);

        assertThat(result.lines()).isEqualTo(lines);
    }

    @Test
    void removeModeStripsPunctuationBeforeProcessing() {
        ProcessingService service = serviceWith(new PassThroughChunkProcessor());

        ProcessingResult result = service.process(List.of("hello, my world!", "¡hola!"),
                PunctuationMode.REMOVE, ProcessingMode.MOCK);

        assertThat(result.lines()).containsExactly("HELLO MY WORLD", "HOLA");
        assertThat(result.markCount()).isZero();
        assertThat(result.aligned()).isTrue();
    }

    @Test
    void keepsEmptyLinesWhenNothingElseIsPresent() {
        ProcessingService service = serviceWith(new PassThroughChunkProcessor());

        ProcessingResult result = service.process(List.of("", ""), PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(result.lines()).containsExactly("", "");
        assertThat(result.chunkCount()).isZero();
    }

    @Test
    void setsAsideWhitespaceOnlyLinesInPreserveMode() {
        List<List<String>> received = new ArrayList<>();
        ProcessingService service = serviceWith(chunks -> {
            received.add(chunks);
            return chunks;
        });

        ProcessingResult result = service.process(List.of("   ", "hello, world!", "\t"),
                PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(received).containsExactly(List.of("hello", "world"));
        assertThat(result.lines()).containsExactly("   ", "hello, world!", "\t");
        assertThat(result.aligned()).isTrue();
    }

    @Test
    void setsAsideBlankLinesInRemoveMode() {
        List<List<String>> received = new ArrayList<>();
        ProcessingService service = serviceWith(chunks -> {
            received.add(chunks);
            return chunks;
        });

        ProcessingResult result = service.process(List.of("", "hello, world!", "!!!", "  "),
                PunctuationMode.REMOVE, ProcessingMode.PRODUCTION);

        assertThat(received).containsExactly(List.of("hello world"));
        assertThat(result.lines()).containsExactly("", "hello world", "", "");
        assertThat(result.chunkCount()).isEqualTo(1);
    }

    @Test
    void reportsMisalignedProcessorOutput() {
        ChunkProcessor droppingProcessor = chunks -> List.of(chunks.get(0));
        ProcessingService service = serviceWith(droppingProcessor);

        ProcessingResult result = service.process(List.of("hello, my world!"),
                PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(result.aligned()).isFalse();
        assertThat(result.lines()).containsExactly("hello,!");
    }

    @Test
    void fallsBackToUnprocessedChunksOnEmptyOutput() {
        ProcessingService service = serviceWith(chunks -> List.of());

        ProcessingResult result = service.process(List.of("keep me, please."),
                PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(result.lines()).containsExactly("keep me, please.");
        assertThat(result.aligned()).isTrue();
    }

    @Test
    void returnsEmptyResultForEmptyInput() {
        ProcessingService service = serviceWith(new PassThroughChunkProcessor());

        assertThat(service.process(List.of(), PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION))
                .isEqualTo(ProcessingResult.empty());
    }

    @Test
    void retriesOnRateLimitExceptionAndEventuallySucceeds() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        ChunkProcessor rateLimitedProcessor = chunks -> {
            if (attemptCount.incrementAndGet() < 3) {
                throw new ProcessingException("Rate limited", new RateLimitException("429 Too Many Requests"));
            }
            return chunks;
        };
        ProcessingService service = serviceWith(rateLimitedProcessor, 5);

        ProcessingResult result = service.process(List.of("again, please!"), PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(result.lines()).containsExactly("again, please!");
        assertThat(attemptCount.get()).isEqualTo(3);
    }

    @Test
    void retriesOnResourceExhaustedMessage() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        ChunkProcessor exhaustedProcessor = chunks -> {
            if (attemptCount.incrementAndGet() < 2) {
                throw new IllegalStateException("RESOURCE_EXHAUSTED: Quota exceeded");
            }
            return chunks;
        };
        ProcessingService service = serviceWith(exhaustedProcessor, 5);

        service.process(List.of("quota"), PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION);

        assertThat(attemptCount.get()).isEqualTo(2);
    }

    @Test
    void failsAfterMaxRetryAttempts() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        ChunkProcessor alwaysLimited = chunks -> {
            attemptCount.incrementAndGet();
            throw new ProcessingException("Rate limited", new RateLimitException("429"));
        };
        ProcessingService service = serviceWith(alwaysLimited, 3);

        assertThatThrownBy(() -> service.process(List.of("never"), PunctuationMode.PRESERVE, ProcessingMode.PRODUCTION))
                .isInstanceOf(ProcessingException.class)
                .hasMessage("Rate limited");
        assertThat(attemptCount.get()).isEqualTo(3);
    }

    @Test
    void doesNotRetryOtherFailures() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        ChunkProcessor brokenProcessor = chunks -> {
            attemptCount.incrementAndGet();
            throw new IllegalStateException("boom");
        };
        ProcessingService service = serviceWith(brokenProcessor, 5);

        assertThatThrownBy(() -> service.process(List.of("text"), PunctuationMode.REMOVE, ProcessingMode.PRODUCTION))
                .isInstanceOf(ProcessingException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(attemptCount.get()).isEqualTo(1);
    }

    @Test
    void validatesRetryConfiguration() {
        ChunkProcessorFactory factory = factoryWith(new PassThroughChunkProcessor());

        assertThatThrownBy(() -> new ProcessingService(factory, PRESERVER, 0, Duration.ofMillis(1), Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetryAttempts");
        assertThatThrownBy(() -> new ProcessingService(factory, PRESERVER, 1, Duration.ZERO, Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialBackoff");
        assertThatThrownBy(() -> new ProcessingService(factory, PRESERVER, 1, Duration.ofMillis(10), Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBackoff");
    }

    private static ProcessingService serviceWith(ChunkProcessor production) {
        return serviceWith(production, 1);
    }

    private static ProcessingService serviceWith(ChunkProcessor production, int maxRetryAttempts) {
        return new ProcessingService(factoryWith(production), PRESERVER,
                maxRetryAttempts, Duration.ofMillis(5), Duration.ofMillis(20));
    }

    private static ChunkProcessorFactory factoryWith(ChunkProcessor production) {
        return new ChunkProcessorFactory(production, new PassThroughChunkProcessor(), new MockChunkProcessor());
    }
}
