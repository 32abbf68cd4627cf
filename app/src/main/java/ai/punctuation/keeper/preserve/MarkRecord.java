package ai.punctuation.keeper.preserve;

import java.util.Objects;

/**
 * A mark run removed from a line, kept for restoration.
 *
 * @param lineIndex index of the source line in the preserved input
 * @param mark      the run exactly as matched, enclosed whitespace included
 * @param position  where the run sat in its line
 */
public record MarkRecord(int lineIndex, String mark, MarkPosition position) {

    public MarkRecord {
        if (lineIndex < 0) {
            throw new IllegalArgumentException("lineIndex must be greater than or equal to zero");
        }
        Objects.requireNonNull(mark, "mark");
        if (mark.isEmpty()) {
            throw new IllegalArgumentException("mark must not be empty");
        }
        Objects.requireNonNull(position, "position");
    }
}
