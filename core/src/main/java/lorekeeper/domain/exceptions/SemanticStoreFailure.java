package lorekeeper.domain.exceptions;

/**
 * Represents a failure reading from or writing to the semantic store. This is passed on to the caller of
 * store() and retrieve(), never swallowed.
 */
public class SemanticStoreFailure extends RuntimeException {
    public SemanticStoreFailure() {
        super();
    }

    public SemanticStoreFailure(final String message) {
        super(message);
    }

    public SemanticStoreFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SemanticStoreFailure(final Throwable cause) {
        super(cause);
    }
}
