package lorekeeper.infrastructure;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import lorekeeper.domain.injection.Preferred;
import lorekeeper.infrastructure.llm.LlmClient;
import lorekeeper.infrastructure.mock.MockLlmClient;
import lorekeeper.infrastructure.ollama.OllamaClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Produces a LlmClient instance based on the configuration.
 */
@ApplicationScoped
public class LlmClientProducer {

    @Inject
    @ConfigProperty(name = "lk.llm.client", defaultValue = "ollama")
    private String client;

    @Produces
    @Preferred
    @ApplicationScoped
    public LlmClient produceLlmClient(final OllamaClient ollamaClient, final MockLlmClient mockLlmClient) {
        if ("mock".equalsIgnoreCase(client)) {
            return mockLlmClient;
        }

        return ollamaClient;
    }
}
