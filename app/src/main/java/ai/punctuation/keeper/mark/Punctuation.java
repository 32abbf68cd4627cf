package ai.punctuation.keeper.mark;

/**
 * Entry point for building {@link MarkMatcher} instances.
 */
public final class Punctuation {

    /**
     * Marks handled when nothing else is configured.
     */
    public static final String DEFAULT_MARKS = ";:,.!?¡¿—…\"«»“”";

    private Punctuation() {
    }

    public static MarkMatcher configure(CharSequence marks) {
        return new MarkMatcher(marks);
    }

    public static MarkMatcher configureDefault() {
        return new MarkMatcher(DEFAULT_MARKS);
    }
}
