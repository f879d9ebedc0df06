package lorekeeper.infrastructure.ollama;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ModelConfig;
import lorekeeper.domain.exceptionhandling.LoggingExceptionHandler;
import lorekeeper.domain.exceptions.ExternalException;
import lorekeeper.domain.exceptions.FailedOllama;
import lorekeeper.domain.json.JsonDeserializerJackson;
import lorekeeper.domain.logger.Loggers;
import lorekeeper.domain.response.OkResponseValidation;
import lorekeeper.domain.sanitize.GetFirstMarkdownBlock;
import lorekeeper.domain.sanitize.GetJsonObject;
import lorekeeper.infrastructure.llm.LlmConnection;
import lorekeeper.infrastructure.llm.StructuredResponseParser;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(OllamaClient.class)
@AddBeanClasses(ModelConfig.class)
@AddBeanClasses(OkResponseValidation.class)
@AddBeanClasses(StructuredResponseParser.class)
@AddBeanClasses(GetFirstMarkdownBlock.class)
@AddBeanClasses(GetJsonObject.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class OllamaClientTest {

    @Inject
    OllamaClient ollamaClient;

    /**
     * Nothing listens on port 1, so every call fails to connect.
     */
    @BeforeEach
    void updateConfig() {
        registerConfig(Map.of(
                "lk.llm.url", "http://localhost:1",
                "lk.llm.retries", "0"));
    }

    @Test
    public void testLeasesAreCounted() {
        final LlmConnection first = ollamaClient.connect();
        final LlmConnection second = ollamaClient.connect();

        Assertions.assertEquals(2, ollamaClient.getOpenConnections());

        first.close();
        first.close();
        Assertions.assertEquals(1, ollamaClient.getOpenConnections());

        second.close();
        Assertions.assertEquals(0, ollamaClient.getOpenConnections());
    }

    @Test
    public void testLeaseIsReleasedWhenCallFails() {
        Assertions.assertThrows(FailedOllama.class, () -> {
            try (LlmConnection connection = ollamaClient.connect()) {
                ollamaClient.generate("Say hello", 0.3);
            }
        });

        Assertions.assertEquals(0, ollamaClient.getOpenConnections());
    }

    @Test
    public void testUnreachableServiceIsExternalFailure() {
        final FailedOllama failure = Assertions.assertThrows(FailedOllama.class,
                () -> ollamaClient.generateStructured("Say hello", 0.3, Map.class));

        Assertions.assertInstanceOf(ExternalException.class, failure);
    }

    @Test
    public void testLeaseClosedDuringCallKeepsClientOpen() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse.Builder()
                    .code(200)
                    .addHeader("Content-Type", "application/json")
                    .body("{\"model\": \"llama3.2\", \"response\": \"hello\"}")
                    .headersDelay(1, TimeUnit.SECONDS)
                    .build());
            server.start();

            registerConfig(Map.of(
                    "lk.llm.url", server.url("").toString().replaceAll("/$", ""),
                    "lk.llm.retries", "0"));

            final ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                final LlmConnection connection = ollamaClient.connect();
                final Future<String> call = executor.submit(() -> ollamaClient.generate("Say hello", 0.3));

                Assertions.assertNotNull(server.takeRequest(10, TimeUnit.SECONDS));
                connection.close();

                Assertions.assertEquals("hello", call.get(10, TimeUnit.SECONDS));
                Assertions.assertEquals(0, ollamaClient.getOpenConnections());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    /**
     * <a href="https://github.com/weld/weld-testing/issues/81#issuecomment-1564002983">...</a>
     */
    private void registerConfig(final Map<String, String> properties) {
        final var configSource = new PropertiesConfigSource(
                properties,
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }
}
