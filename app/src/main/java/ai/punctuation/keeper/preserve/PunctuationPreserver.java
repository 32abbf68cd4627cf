package ai.punctuation.keeper.preserve;

import ai.punctuation.keeper.mark.DigitSeparator;
import ai.punctuation.keeper.mark.MarkMatcher;
import ai.punctuation.keeper.mark.MarkUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hides punctuation from a text processor and puts it back afterwards.
 *
 * <p>{@link #preserve(List)} splits each line into punctuation-free chunks and records the
 * removed mark runs. Once the chunks went through a processor that keeps their number and order,
 * {@link #restore(List, List)} interleaves them with the recorded marks again:
 *
 * <pre>
 *   "hello, my world!"  ->  ["hello", "my world"] + [", " (I), "!" (E)]
 *   ["HELLO", "MY WORLD"] + marks  ->  ["HELLO, MY WORLD!"]
 * </pre>
 *
 * <p>Instances hold no state besides the immutable matcher and can be shared between threads.
 */
public class PunctuationPreserver {

    private static final Logger LOGGER = LoggerFactory.getLogger(PunctuationPreserver.class);

    private final MarkMatcher matcher;

    public PunctuationPreserver(MarkMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public String remove(String text) {
        return matcher.remove(text);
    }

    public List<String> remove(List<String> lines) {
        return matcher.remove(lines);
    }

    public PreservedText preserve(String line) {
        return preserve(List.of(Objects.requireNonNull(line, "line")));
    }

    public PreservedText preserve(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<String> chunks = new ArrayList<>();
        List<MarkRecord> marks = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            preserveLine(Objects.requireNonNull(lines.get(index), "line"), index, chunks, marks);
        }
        LOGGER.debug("Preserved {} lines into {} chunks and {} marks", lines.size(), chunks.size(), marks.size());
        return new PreservedText(chunks, marks);
    }

    private void preserveLine(String rawLine, int index, List<String> chunks, List<MarkRecord> marks) {
        String line = DigitSeparator.escapeAll(rawLine);
        List<MarkUnit> units = matcher.detect(line);
        if (units.isEmpty()) {
            addChunk(chunks, line);
            return;
        }

        // nothing but punctuation on this line
        if (units.size() == 1 && units.get(0).spans(line)) {
            marks.add(new MarkRecord(index, DigitSeparator.unescapeAll(line), MarkPosition.ALONE));
            return;
        }

        int offset = 0;
        for (int i = 0; i < units.size(); i++) {
            MarkUnit unit = units.get(i);
            marks.add(new MarkRecord(index, unit.text(), classify(unit, i, units.size(), line)));
            addChunk(chunks, line.substring(offset, unit.start()));
            offset = unit.end();
        }
        addChunk(chunks, line.substring(offset));
    }

    private MarkPosition classify(MarkUnit unit, int ordinal, int count, String line) {
        if (ordinal == 0 && unit.start() == 0) {
            return MarkPosition.BEGIN;
        }
        if (ordinal == count - 1 && unit.end() == line.length()) {
            return MarkPosition.END;
        }
        return MarkPosition.MIDDLE;
    }

    private void addChunk(List<String> chunks, String escapedChunk) {
        if (!escapedChunk.isEmpty()) {
            chunks.add(DigitSeparator.unescapeAll(escapedChunk));
        }
    }

    /**
     * Rebuilds punctuated lines from processed chunks and the marks recorded by
     * {@link #preserve(List)}.
     *
     * <p>Chunks are expected to match the preserved chunks in number and order. When they do not,
     * the result degrades instead of failing: marks left over once every chunk has been used are
     * joined into a final line, and a middle mark without a following chunk is appended to the
     * last chunk.
     */
    public List<String> restore(List<String> processedChunks, List<MarkRecord> marks) {
        Objects.requireNonNull(processedChunks, "processedChunks");
        Objects.requireNonNull(marks, "marks");

        Deque<String> pending = new ArrayDeque<>(processedChunks.size());
        for (String chunk : processedChunks) {
            pending.addLast(Objects.requireNonNull(chunk, "chunk"));
        }
        List<String> restored = new ArrayList<>();
        int markIndex = 0;
        int num = 0;

        while (true) {
            if (markIndex == marks.size()) {
                restored.addAll(pending);
                break;
            }
            if (pending.isEmpty()) {
                restored.add(joinMarks(marks.subList(markIndex, marks.size())));
                break;
            }

            MarkRecord current = marks.get(markIndex);
            if (current.lineIndex() != num) {
                restored.add(pending.removeFirst());
                num++;
                continue;
            }

            String head = pending.removeFirst().stripTrailing();
            markIndex++;
            switch (current.position()) {
                case BEGIN -> pending.addFirst(current.mark() + head);
                case END -> {
                    restored.add(head + current.mark());
                    num++;
                }
                case ALONE -> {
                    pending.addFirst(head);
                    restored.add(current.mark());
                    num++;
                }
                case MIDDLE -> {
                    String next = pending.pollFirst();
                    if (next == null) {
                        LOGGER.debug("No chunk follows middle mark '{}' of line {}; appending it", current.mark(), num);
                        pending.addFirst(head + current.mark());
                    } else {
                        pending.addFirst(head + current.mark() + next);
                    }
                }
            }
        }
        return List.copyOf(restored);
    }

    private static String joinMarks(List<MarkRecord> marks) {
        StringBuilder builder = new StringBuilder();
        for (MarkRecord mark : marks) {
            builder.append(mark.mark());
        }
        return builder.toString();
    }
}
