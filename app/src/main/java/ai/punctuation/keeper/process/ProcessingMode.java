package ai.punctuation.keeper.process;

/**
 * Selects which {@link ChunkProcessor} handles the chunks.
 */
public enum ProcessingMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static ProcessingMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (ProcessingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported processing mode: " + raw);
    }
}
