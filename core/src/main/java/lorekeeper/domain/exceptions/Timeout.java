package lorekeeper.domain.exceptions;

/**
 * Thrown when a call to an external service, or the processing of a single raw item, took longer than allowed.
 */
public class Timeout extends RuntimeException implements ExternalException {
    public Timeout() {
        super();
    }

    public Timeout(final String message) {
        super(message);
    }

    public Timeout(final String message, final Throwable cause) {
        super(message, cause);
    }

    public Timeout(final Throwable cause) {
        super(cause);
    }
}
