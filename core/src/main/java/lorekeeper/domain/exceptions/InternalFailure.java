package lorekeeper.domain.exceptions;

/**
 * A concrete type for failures that retrying will not fix. Anything that is not explicitly an ExternalException is
 * mapped to this type by ExceptionMapping.
 */
public class InternalFailure extends RuntimeException implements InternalException {
    public InternalFailure() {
        super();
    }

    public InternalFailure(final String message) {
        super(message);
    }

    public InternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InternalFailure(final Throwable cause) {
        super(cause);
    }
}
