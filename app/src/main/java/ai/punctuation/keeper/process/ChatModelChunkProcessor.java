package ai.punctuation.keeper.process;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chunk processor backed by a LangChain4j {@link ChatModel} implementation.
 *
 * <p>All chunks go out in a single prompt, one chunk per line; the response is read back line by
 * line.
 */
public class ChatModelChunkProcessor implements ChunkProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelChunkProcessor.class);

    private final ChatModel model;
    private final String modelName;
    private final String instruction;

    public ChatModelChunkProcessor(ChatModel model, String modelName, String instruction) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.instruction = requireNonBlank(instruction, "instruction");
    }

    @Override
    public List<String> process(List<String> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        String response;
        try {
            response = model.chat(buildPrompt(chunks));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new ProcessingException("Model '%s' is not available.".formatted(modelName), ex);
            }
            throw new ProcessingException("Chat model processing failed", ex);
        }
        if (response == null) {
            return List.of();
        }
        List<String> lines = Arrays.stream(response.split("\\R", -1))
                .map(String::stripTrailing)
                .collect(Collectors.toCollection(ArrayList::new));
        trimBlankEdges(lines, chunks);
        if (lines.size() != chunks.size()) {
            LOGGER.warn("Model '{}' returned {} lines for {} chunks", modelName, lines.size(), chunks.size());
        }
        return List.copyOf(lines);
    }

    String buildPrompt(List<String> chunks) {
        String joined = String.join("\n", chunks);
        return instruction + """

Rules:
- The input holds %d lines. Answer with exactly %d lines, one for each input line, in the same order.
- Never merge or split lines and never add blank lines.
- Do not add punctuation marks.
- Output only the processed lines as plain text, without numbering, code fences or commentary.

<lines>
""".formatted(chunks.size(), chunks.size()) + joined + "\n</lines>";
    }

    private static void trimBlankEdges(List<String> lines, List<String> chunks) {
        // a blank edge line is only noise when the chunk it would answer is not blank itself
        while (!lines.isEmpty() && lines.get(0).isBlank() && !chunks.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()
                && (lines.size() > chunks.size() || !chunks.get(chunks.size() - 1).isBlank())) {
            lines.remove(lines.size() - 1);
        }
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
