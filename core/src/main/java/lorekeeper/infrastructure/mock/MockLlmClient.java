package lorekeeper.infrastructure.mock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.infrastructure.llm.LlmClient;
import lorekeeper.infrastructure.llm.LlmConnection;
import lorekeeper.infrastructure.llm.StructuredResponseParser;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A client that answers from a scripted responder instead of a model. Selected with lk.llm.client=mock, and used by
 * tests to count calls and inject failures.
 */
@ApplicationScoped
public class MockLlmClient implements LlmClient {
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    @Inject
    private StructuredResponseParser structuredResponseParser;

    private Function<String, String> responder = prompt -> "{}";

    @Nullable
    private RuntimeException failure;

    public void setMockResponse(@Nullable final String response) {
        this.responder = prompt -> Objects.requireNonNullElse(response, "");
    }

    /**
     * Answer each prompt with a function of the prompt. The responder may throw to simulate a failed call.
     */
    public void setResponder(final Function<String, String> responder) {
        this.responder = responder;
    }

    /**
     * Make every call fail with the given exception, or clear the failure with null.
     */
    public void setFailure(@Nullable final RuntimeException failure) {
        this.failure = failure;
    }

    public int getCallCount() {
        return calls.get();
    }

    public List<String> getPrompts() {
        return List.copyOf(prompts);
    }

    public int getOpenConnections() {
        return openConnections.get();
    }

    @Override
    public LlmConnection connect() {
        openConnections.incrementAndGet();
        final AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                openConnections.decrementAndGet();
            }
        };
    }

    @Override
    public String generate(final String prompt, final double temperature) {
        calls.incrementAndGet();
        prompts.add(prompt);

        if (failure != null) {
            throw failure;
        }

        return Objects.requireNonNullElse(responder.apply(prompt), "");
    }

    @Override
    public <T> T generateStructured(final String prompt, final double temperature, final Class<T> clazz) {
        return structuredResponseParser.parse(generate(prompt, temperature), clazz);
    }
}
