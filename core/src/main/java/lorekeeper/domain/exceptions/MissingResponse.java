package lorekeeper.domain.exceptions;

/**
 * Thrown when the generative text service answered with a 404, usually because the model has not been pulled.
 */
public class MissingResponse extends RuntimeException implements ExternalException {
    public MissingResponse() {
        super();
    }

    public MissingResponse(final String message) {
        super(message);
    }

    public MissingResponse(final String message, final Throwable cause) {
        super(message, cause);
    }

    public MissingResponse(final Throwable cause) {
        super(cause);
    }
}
