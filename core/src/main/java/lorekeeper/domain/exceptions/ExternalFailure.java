package lorekeeper.domain.exceptions;

/**
 * A concrete type for failures from an external source. Vavr methods like Try.recover() need a class rather than an
 * interface, so exceptions implementing ExternalException are mapped to this type by ExceptionMapping.
 */
public class ExternalFailure extends RuntimeException implements ExternalException {
    public ExternalFailure() {
        super();
    }

    public ExternalFailure(final String message) {
        super(message);
    }

    public ExternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExternalFailure(final Throwable cause) {
        super(cause);
    }
}
