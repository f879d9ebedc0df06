package lorekeeper.domain.exceptions;

/**
 * Marker interface for failures caused by something outside this process, like the generative text service. These
 * might go away if the call is repeated.
 */
public interface ExternalException {
}
