package lorekeeper.domain.exceptions;

/**
 * Thrown when a string that must have content is null or blank.
 */
public class EmptyString extends RuntimeException implements InternalException {
    public EmptyString() {
        super();
    }

    public EmptyString(final String message) {
        super(message);
    }

    public EmptyString(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EmptyString(final Throwable cause) {
        super(cause);
    }
}
