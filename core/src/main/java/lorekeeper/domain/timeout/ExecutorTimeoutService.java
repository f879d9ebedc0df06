package lorekeeper.domain.timeout;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.exceptions.InternalFailure;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Bridges blocking calls onto a pool of daemon threads. Work that runs past its limit is interrupted and abandoned.
 */
@ApplicationScoped
public class ExecutorTimeoutService implements TimeoutService {
    private final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("lorekeeper-worker-%d")
            .setDaemon(true)
            .build());

    @Inject
    private Logger logger;

    @PreDestroy
    public void preDestroy() {
        executor.shutdownNow();
    }

    @Override
    public <T> T executeWithTimeout(final TimeoutFunctionCallback<T> callback, final TimeoutFunctionCallback<T> onTimeout, final long timeoutSeconds) {
        checkNotNull(callback, "callback must not be null");
        checkNotNull(onTimeout, "onTimeout must not be null");
        checkArgument(timeoutSeconds > 0, "timeoutSeconds must be positive");

        final Future<T> future = executor.submit(callback::apply);

        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (final TimeoutException e) {
            logger.warning("Operation timed out after " + timeoutSeconds + " seconds");
            future.cancel(true);
            return onTimeout.apply();
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new InternalFailure(e.getCause());
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InternalFailure("Interrupted while waiting for a background operation", e);
        }
    }
}
