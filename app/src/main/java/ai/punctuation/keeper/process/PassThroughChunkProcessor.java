package ai.punctuation.keeper.process;

import java.util.ArrayList;
import java.util.List;

/**
 * Processor used for dry runs that returns the chunks untouched without invoking a model.
 */
public class PassThroughChunkProcessor implements ChunkProcessor {

    @Override
    public List<String> process(List<String> chunks) {
        if (chunks == null) {
            return List.of();
        }
        return new ArrayList<>(chunks);
    }
}
