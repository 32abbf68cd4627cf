package ai.punctuation.keeper.mark;

/**
 * Raised when a punctuation mark set cannot be turned into a matching rule.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
