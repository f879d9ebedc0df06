package lorekeeper.domain.exceptions;

/**
 * Thrown when a semantic record breaks one of the data model rules, e.g. a Q&amp;A without an answer or a glossary entry without a term. Records that fail validation are dropped, never persisted.
 */
public class InvalidRecord extends RuntimeException implements InternalException {
    public InvalidRecord() {
        super();
    }

    public InvalidRecord(final String message) {
        super(message);
    }

    public InvalidRecord(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidRecord(final Throwable cause) {
        super(cause);
    }
}
