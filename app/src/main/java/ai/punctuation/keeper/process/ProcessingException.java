package ai.punctuation.keeper.process;

/**
 * Runtime exception used to propagate chunk processing failures.
 */
public class ProcessingException extends RuntimeException {

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
