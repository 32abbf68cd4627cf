package ai.punctuation.keeper.config;

import java.net.URI;
import java.util.Objects;

/**
 * Settings of the Ollama chat model used as production chunk processor.
 */
public record ProcessorConfig(String modelName, URI baseUrl, String instruction) {

    public ProcessorConfig {
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        instruction = requireNonBlank(instruction, "instruction");
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
