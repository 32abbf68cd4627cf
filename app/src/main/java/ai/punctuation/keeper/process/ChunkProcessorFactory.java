package ai.punctuation.keeper.process;

import java.util.Objects;

/**
 * Provides chunk processors based on the desired execution mode.
 */
public class ChunkProcessorFactory {

    private final ChunkProcessor productionProcessor;
    private final ChunkProcessor dryRunProcessor;
    private final ChunkProcessor mockProcessor;

    public ChunkProcessorFactory(ChunkProcessor productionProcessor,
                                 ChunkProcessor dryRunProcessor,
                                 ChunkProcessor mockProcessor) {
        this.productionProcessor = Objects.requireNonNull(productionProcessor, "productionProcessor");
        this.dryRunProcessor = Objects.requireNonNull(dryRunProcessor, "dryRunProcessor");
        this.mockProcessor = Objects.requireNonNull(mockProcessor, "mockProcessor");
    }

    public ChunkProcessor select(ProcessingMode mode) {
        return switch (mode) {
            case PRODUCTION -> productionProcessor;
            case DRY_RUN -> dryRunProcessor;
            case MOCK -> mockProcessor;
        };
    }
}
