package ai.punctuation.keeper.process;

/**
 * What happens to punctuation around the chunk processor.
 */
public enum PunctuationMode {
    /** Hide marks from the processor and restore them in its output. */
    PRESERVE,
    /** Strip marks before processing; nothing is restored. */
    REMOVE;

    public static PunctuationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRESERVE;
        }
        for (PunctuationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported punctuation mode: " + raw);
    }
}
