package ai.punctuation.keeper.mark;

import java.util.Objects;

/**
 * A maximal run of marks (with surrounding whitespace) found in a single line.
 */
public record MarkUnit(String text, int start, int end) {

    public MarkUnit {
        Objects.requireNonNull(text, "text");
        if (start < 0 || end < start || end - start != text.length()) {
            throw new IllegalArgumentException("Invalid mark unit boundaries");
        }
    }

    public boolean spans(String line) {
        return start == 0 && end == line.length();
    }
}
