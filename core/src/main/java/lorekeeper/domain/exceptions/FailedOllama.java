package lorekeeper.domain.exceptions;

/**
 * Thrown when Ollama could not be reached or kept failing after all retries.
 */
public class FailedOllama extends RuntimeException implements ExternalException {
    public FailedOllama() {
        super();
    }

    public FailedOllama(final String message) {
        super(message);
    }

    public FailedOllama(final String message, final Throwable cause) {
        super(message, cause);
    }

    public FailedOllama(final Throwable cause) {
        super(cause);
    }
}
