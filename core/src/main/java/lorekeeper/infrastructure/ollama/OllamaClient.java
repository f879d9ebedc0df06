package lorekeeper.infrastructure.ollama;

import io.vavr.control.Try;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lorekeeper.domain.config.ModelConfig;
import lorekeeper.domain.exceptionhandling.ExceptionHandler;
import lorekeeper.domain.exceptions.FailedOllama;
import lorekeeper.domain.exceptions.InvalidResponse;
import lorekeeper.domain.exceptions.MissingResponse;
import lorekeeper.domain.response.ResponseValidation;
import lorekeeper.infrastructure.llm.LlmClient;
import lorekeeper.infrastructure.llm.LlmConnection;
import lorekeeper.infrastructure.llm.StructuredResponseParser;
import lorekeeper.infrastructure.ollama.api.OllamaGenerateBody;
import lorekeeper.infrastructure.ollama.api.OllamaGenerateBodyOptions;
import lorekeeper.infrastructure.ollama.api.OllamaResponse;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Calls the Ollama generate API. Only one call is in flight at a time.
 * <p>
 * The JAX-RS client is shared while at least one {@link LlmConnection} is open. It is closed once the last lease is
 * released and no call is still using it. Calls made without an open connection create and close their own client.
 */
@ApplicationScoped
public class OllamaClient implements LlmClient {
    private static final Semaphore SEMAPHORE = new Semaphore(1);
    private static final long RETRY_DELAY = 1000L;

    @Inject
    @ConfigProperty(name = "lk.llm.url", defaultValue = "http://localhost:11434")
    private String uri;

    @Inject
    @ConfigProperty(name = "lk.llm.retries", defaultValue = "3")
    private String retries;

    @Inject
    private ModelConfig modelConfig;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private StructuredResponseParser structuredResponseParser;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Nullable
    private Client sharedClient;

    private int openConnections;

    private int activeCalls;

    @Override
    public synchronized LlmConnection connect() {
        if (sharedClient == null) {
            logger.fine("Opening Ollama client");
            sharedClient = ClientBuilder.newClient();
        }
        openConnections++;
        return new Lease();
    }

    @PreDestroy
    public synchronized void preDestroy() {
        closeSharedClient();
        openConnections = 0;
        activeCalls = 0;
    }

    @Override
    public String generate(final String prompt, final double temperature) {
        checkArgument(StringUtils.isNotBlank(prompt), "prompt must not be blank");

        return call(buildBody(prompt, temperature, null)).response();
    }

    @Override
    public <T> T generateStructured(final String prompt, final double temperature, final Class<T> clazz) {
        checkArgument(StringUtils.isNotBlank(prompt), "prompt must not be blank");

        final OllamaResponse response = call(buildBody(prompt, temperature, OllamaGenerateBody.JSON_FORMAT));
        return structuredResponseParser.parse(response.response(), clazz);
    }

    /**
     * The number of leases that have not been closed yet.
     */
    public synchronized int getOpenConnections() {
        return openConnections;
    }

    private OllamaGenerateBody buildBody(final String prompt, final double temperature, @Nullable final String format) {
        return new OllamaGenerateBody(
                modelConfig.getModel(),
                prompt,
                false,
                format,
                new OllamaGenerateBodyOptions(temperature, modelConfig.getContextWindow()));
    }

    private OllamaResponse call(final OllamaGenerateBody body) {
        final Client client = borrowSharedClient();

        if (client == null) {
            return Try.withResources(ClientBuilder::newClient)
                    .of(newClient -> callOllama(newClient, body, 0))
                    .get();
        }

        try {
            return callOllama(client, body, 0);
        } finally {
            returnSharedClient();
        }
    }

    @Nullable
    private synchronized Client borrowSharedClient() {
        if (sharedClient != null) {
            activeCalls++;
        }
        return sharedClient;
    }

    private synchronized void returnSharedClient() {
        activeCalls--;
        closeIfIdle();
    }

    /**
     * Connection failures are retried. A response from Ollama, good or bad, is never retried.
     */
    private OllamaResponse callOllama(final Client client, final OllamaGenerateBody body, final int retryCount) {
        final int maxRetries = NumberUtils.toInt(retries, 3);

        logger.fine("Calling " + uri + " with model " + body.model() + " and prompt " + DigestUtils.sha256Hex(body.prompt()));
        logger.fine(body.prompt());

        final String target = uri + "/api/generate";

        final OllamaResponse result = Try.of(() -> post(client, target, body))
                .recover(ProcessingException.class, ex -> {
                    if (retryCount >= maxRetries) {
                        throw new FailedOllama("OllamaClient failed to call Ollama after " + maxRetries + " retries", ex);
                    }
                    logger.warning("Retrying Ollama call, attempt " + (retryCount + 1) + ": " + exceptionHandler.getExceptionMessage(ex));
                    waitBeforeRetry((retryCount + 1) * RETRY_DELAY);
                    return callOllama(client, body, retryCount + 1);
                })
                .get();

        logger.fine(result.response());

        return result;
    }

    private OllamaResponse post(final Client client, final String target, final OllamaGenerateBody body) {
        try {
            SEMAPHORE.acquire();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FailedOllama("Interrupted while waiting to call Ollama", e);
        }

        try {
            return Try.withResources(() -> client.target(target)
                            .request()
                            .header("Accept", "application/json")
                            .post(Entity.entity(body.sanitizedCopy(), MediaType.APPLICATION_JSON)))
                    .of(response -> readResponse(response, target, body))
                    .get();
        } finally {
            SEMAPHORE.release();
        }
    }

    private OllamaResponse readResponse(final Response response, final String target, final OllamaGenerateBody body) {
        return Try.of(() -> responseValidation.validate(response, target))
                .recover(InvalidResponse.class, e -> {
                    throw new FailedOllama("OllamaClient failed to call Ollama:\n"
                            + e.getCode() + "\n"
                            + e.getBody(), e);
                })
                .recover(MissingResponse.class, e -> {
                    throw new FailedOllama("OllamaClient failed to call Ollama:\n"
                            + response.getStatus() + "\n"
                            + "Make sure to run 'ollama pull " + body.model() + "'", e);
                })
                .map(r -> r.readEntity(OllamaResponse.class))
                .filter(Objects::nonNull, () -> new FailedOllama("Ollama returned an empty body"))
                .get();
    }

    private void waitBeforeRetry(final long delay) {
        try {
            Thread.sleep(delay);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FailedOllama("Interrupted while waiting to retry the Ollama call", e);
        }
    }

    private synchronized void release() {
        if (openConnections > 0) {
            openConnections--;
        }

        closeIfIdle();
    }

    private void closeIfIdle() {
        if (openConnections == 0 && activeCalls == 0) {
            closeSharedClient();
        }
    }

    private void closeSharedClient() {
        if (sharedClient != null) {
            logger.fine("Closing Ollama client");
            Try.run(sharedClient::close)
                    .onFailure(ex -> logger.warning(exceptionHandler.getExceptionMessage(ex)));
            sharedClient = null;
        }
    }

    private class Lease implements LlmConnection {
        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
