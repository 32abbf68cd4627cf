package ai.punctuation.keeper.process;

import java.util.List;
import java.util.Objects;

/**
 * Output of a processing run.
 *
 * @param lines      processed lines, punctuated again in preserve mode
 * @param chunkCount number of chunks handed to the processor
 * @param markCount  number of mark runs set aside (zero in remove mode)
 * @param aligned    whether the processor returned exactly one chunk per input chunk
 */
public record ProcessingResult(List<String> lines, int chunkCount, int markCount, boolean aligned) {

    public ProcessingResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (chunkCount < 0 || markCount < 0) {
            throw new IllegalArgumentException("counts must be greater than or equal to zero");
        }
    }

    public static ProcessingResult empty() {
        return new ProcessingResult(List.of(), 0, 0, true);
    }
}
