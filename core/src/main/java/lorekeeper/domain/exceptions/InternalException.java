package lorekeeper.domain.exceptions;

/**
 * Marker interface for failures that will happen again if the same call is made with the same data.
 */
public interface InternalException {
}
