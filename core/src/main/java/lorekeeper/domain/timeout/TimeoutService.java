package lorekeeper.domain.timeout;

/**
 * Runs blocking work on a background worker with a time limit.
 */
public interface TimeoutService {
    /**
     * Run the callback, falling back to onTimeout if it does not finish in time. Exceptions thrown by the callback are
     * rethrown to the caller unchanged.
     *
     * @param callback       The work to run
     * @param onTimeout      Supplies the result (or throws) when the work took too long
     * @param timeoutSeconds The time limit
     * @return The result of the callback, or of onTimeout
     */
    <T> T executeWithTimeout(TimeoutFunctionCallback<T> callback, TimeoutFunctionCallback<T> onTimeout, long timeoutSeconds);
}
