package lorekeeper.domain.store;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import lorekeeper.domain.exceptionhandling.LoggingExceptionHandler;
import lorekeeper.domain.exceptions.SemanticStoreFailure;
import lorekeeper.domain.json.JsonDeserializerJackson;
import lorekeeper.domain.logger.Loggers;
import lorekeeper.domain.model.Confidence;
import lorekeeper.domain.model.ContentPayload;
import lorekeeper.domain.model.GlossaryPayload;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.Provenance;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticQuery;
import lorekeeper.domain.model.SemanticRecord;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(H2SemanticStore.class)
@AddBeanClasses(Loggers.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(LoggingExceptionHandler.class)
public class H2SemanticStoreTest {

    @Inject
    H2SemanticStore semanticStore;

    @BeforeEach
    void updateConfig() throws IOException {
        registerConfig(Map.of("lk.store.path", Files.createTempDirectory("semanticstore").toString()));
    }

    @Test
    public void testRoundTrip() {
        final List<SemanticRecord> records = List.of(
                SemanticRecord.qna("How do I deploy?", "Run the pipeline", List.of("deploy"), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Staging is rebuilt nightly", List.of("staging"), threadProvenance()),
                SemanticRecord.reference("https://example.org/runbook", "doc", List.of("runbook"), sectionProvenance()),
                SemanticRecord.glossary(
                        new GlossaryPayload("SLA", "Service level agreement", "service", Confidence.MEDIUM, false,
                                List.of("A contract"), Set.of("ops")),
                        List.of("sla"),
                        sectionProvenance()));

        final List<SemanticRecord> stored = semanticStore.store(records);
        final List<SemanticRecord> retrieved = semanticStore.retrieveAll();

        Assertions.assertEquals(records.size(), stored.size());
        Assertions.assertEquals(records.size(), retrieved.size());
        Assertions.assertEquals(records.size(), stored.stream().map(SemanticRecord::id).distinct().count());

        for (final SemanticRecord record : records) {
            Assertions.assertTrue(retrieved.stream().anyMatch(record::sameContent), "Missing " + record);
        }

        for (final SemanticRecord record : retrieved) {
            Assertions.assertNotNull(record.id());
            Assertions.assertNotNull(record.createdAt());
        }
    }

    @Test
    public void testKeywordsIgnoreCase() {
        semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "Deploys to staging need approval", List.of("deploy", "staging"), threadProvenance())));

        final List<SemanticRecord> results = semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("STAGING")));

        Assertions.assertEquals(1, results.size());
        Assertions.assertEquals("Deploys to staging need approval",
                results.get(0).payloadAs(ContentPayload.class).content());
    }

    @Test
    public void testKeywordsMatchAny() {
        semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "First", List.of("alpha"), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Second", List.of("beta", "Alpha"), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Third", List.of("gamma"), threadProvenance())));

        Assertions.assertEquals(2, semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("alpha"))).size());
        Assertions.assertEquals(3, semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("ALPHA", "gamma"))).size());
        Assertions.assertTrue(semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("delta"))).isEmpty());
    }

    @Test
    public void testNewestFirst() {
        semanticStore.store(List.of(SemanticRecord.content(SemanticKind.INSIGHT, "Older", List.of(), threadProvenance())));
        semanticStore.store(List.of(SemanticRecord.content(SemanticKind.INSIGHT, "Newer", List.of(), threadProvenance())));

        final List<SemanticRecord> results = semanticStore.retrieveAll();

        Assertions.assertEquals(2, results.size());
        Assertions.assertEquals("Newer", results.get(0).payloadAs(ContentPayload.class).content());
        Assertions.assertEquals("Older", results.get(1).payloadAs(ContentPayload.class).content());
    }

    @Test
    public void testCreatedAtNeverDecreases() {
        final List<SemanticRecord> stored = semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "One", List.of(), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Two", List.of(), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Three", List.of(), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Four", List.of(), threadProvenance())));

        for (int i = 1; i < stored.size(); ++i) {
            Assertions.assertFalse(stored.get(i).createdAt().isBefore(stored.get(i - 1).createdAt()));
        }
    }

    @Test
    public void testFilterByKindAndOrigin() {
        semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "From a thread", List.of(), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "From a document", List.of(), sectionProvenance()),
                SemanticRecord.content(SemanticKind.FEEDBACK, "Feedback from a thread", List.of(), threadProvenance())));

        Assertions.assertEquals(2, semanticStore.retrieve(SemanticQuery.all().withKind(SemanticKind.INSIGHT)).size());
        Assertions.assertEquals(2, semanticStore.retrieve(SemanticQuery.all().withOriginKind(OriginKind.THREAD)).size());

        final List<SemanticRecord> both = semanticStore.retrieve(SemanticQuery.all()
                .withKind(SemanticKind.INSIGHT)
                .withOriginKind(OriginKind.DOCUMENT_SECTION));

        Assertions.assertEquals(1, both.size());
        Assertions.assertEquals(OriginKind.DOCUMENT_SECTION, both.get(0).provenance().originKind());
    }

    @Test
    public void testFilterByCreatedAt() {
        final SemanticRecord stored = semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "Timed", List.of(), threadProvenance()))).get(0);

        Assertions.assertEquals(1, semanticStore.retrieve(SemanticQuery.all()
                .withCreatedBetween(stored.createdAt(), stored.createdAt())).size());
        Assertions.assertTrue(semanticStore.retrieve(SemanticQuery.all()
                .withCreatedBetween(stored.createdAt().plusSeconds(3600), null)).isEmpty());
        Assertions.assertTrue(semanticStore.retrieve(SemanticQuery.all()
                .withCreatedBetween(null, stored.createdAt().minusSeconds(3600))).isEmpty());
    }

    @Test
    public void testStoreNothing() {
        Assertions.assertTrue(semanticStore.store(List.of()).isEmpty());
        Assertions.assertTrue(semanticStore.retrieveAll().isEmpty());
    }

    @Test
    public void testUnusablePathFails() throws IOException {
        final Path file = Files.createTempFile("semanticstore", ".txt");
        registerConfig(Map.of(
                "lk.store.path", file.toString(),
                "lk.store.connectionretries", "0"));

        Assertions.assertThrows(SemanticStoreFailure.class, () -> semanticStore.retrieveAll());
    }

    @Test
    public void testLongKeywordsAreIndexed() {
        final String longKeyword = "k".repeat(1500);

        final List<SemanticRecord> stored = semanticStore.store(List.of(
                SemanticRecord.content(SemanticKind.INSIGHT, "Before", List.of("short"), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "Long", List.of(longKeyword), threadProvenance()),
                SemanticRecord.content(SemanticKind.INSIGHT, "After", List.of("short"), threadProvenance())));

        Assertions.assertEquals(3, stored.size());
        Assertions.assertEquals(3, semanticStore.retrieveAll().size());

        final List<SemanticRecord> results = semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of(longKeyword.toUpperCase(Locale.ROOT))));
        Assertions.assertEquals(1, results.size());
        Assertions.assertEquals("Long", results.get(0).payloadAs(ContentPayload.class).content());
    }

    @Test
    public void testKeywordsIgnoreCaseInAnyLocale() {
        final Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            semanticStore.store(List.of(
                    SemanticRecord.content(SemanticKind.INSIGHT, "Incidents need a review", List.of("INCIDENT"), threadProvenance())));

            Assertions.assertEquals(1, semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("incident"))).size());
            Assertions.assertEquals(1, semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("Incident"))).size());
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    public void testReadersNeverSeeRecordsWithoutKeywords() throws Exception {
        final int count = 100;
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < count; ++i) {
                    semanticStore.store(List.of(
                            SemanticRecord.content(SemanticKind.INSIGHT, "Record " + i, List.of("race", "record" + i), threadProvenance())));
                }
            });

            while (!writer.isDone()) {
                final int byKind = semanticStore.retrieve(SemanticQuery.all().withKind(SemanticKind.INSIGHT)).size();
                final int byKeyword = semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("race"))).size();

                Assertions.assertTrue(byKeyword >= byKind,
                        byKind + " records were visible but only " + byKeyword + " could be found by keyword");
            }

            writer.get(60, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        Assertions.assertEquals(count, semanticStore.retrieve(SemanticQuery.all().withKeywords(List.of("race"))).size());
    }

    private Provenance threadProvenance() {
        return Provenance.thread("C123", "1700000000.000100", List.of("alice", "bob"), List.of("https://chat.example.org/p1"));
    }

    private Provenance sectionProvenance() {
        return Provenance.documentSection("doc-1", "Runbook", "Deploying");
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
