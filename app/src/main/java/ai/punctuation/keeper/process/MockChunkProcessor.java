package ai.punctuation.keeper.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic processor that upper-cases every chunk.
 */
public class MockChunkProcessor implements ChunkProcessor {

    @Override
    public List<String> process(List<String> chunks) {
        List<String> result = new ArrayList<>(chunks.size());
        for (String chunk : chunks) {
            result.add(chunk.toUpperCase(Locale.ROOT));
        }
        return result;
    }
}
