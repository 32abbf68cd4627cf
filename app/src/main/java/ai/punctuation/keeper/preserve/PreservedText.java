package ai.punctuation.keeper.preserve;

import java.util.List;
import java.util.Objects;

/**
 * Punctuation-free chunks and the marks taken out of them.
 */
public record PreservedText(List<String> chunks, List<MarkRecord> marks) {

    public PreservedText {
        chunks = List.copyOf(Objects.requireNonNull(chunks, "chunks"));
        marks = List.copyOf(Objects.requireNonNull(marks, "marks"));
    }

    public int chunkCount() {
        return chunks.size();
    }

    public int markCount() {
        return marks.size();
    }
}
