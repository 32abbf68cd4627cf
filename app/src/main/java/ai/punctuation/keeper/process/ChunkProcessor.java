package ai.punctuation.keeper.process;

import java.util.List;

/**
 * Downstream text processor fed with punctuation-free chunks.
 *
 * <p>Implementations are expected to return one processed chunk per input chunk, in input order.
 */
@FunctionalInterface
public interface ChunkProcessor {

    List<String> process(List<String> chunks);
}
