package lorekeeper.domain.extraction.strategies;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import lorekeeper.domain.config.ModelConfig;
import lorekeeper.domain.exceptionhandling.LoggingExceptionHandler;
import lorekeeper.domain.exceptionhandling.StandardExceptionMapping;
import lorekeeper.domain.exceptions.FailedOllama;
import lorekeeper.domain.injection.Preferred;
import lorekeeper.domain.json.JsonDeserializerJackson;
import lorekeeper.domain.logger.Loggers;
import lorekeeper.domain.model.GlossaryPayload;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.QnaPayload;
import lorekeeper.domain.model.ReferencePayload;
import lorekeeper.domain.model.SemanticKind;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.raw.ThreadItem;
import lorekeeper.domain.raw.ThreadMessage;
import lorekeeper.domain.sanitize.GetFirstMarkdownBlock;
import lorekeeper.domain.sanitize.GetJsonObject;
import lorekeeper.domain.sanitize.RemoveSlackMarkup;
import lorekeeper.domain.validate.SemanticRecordValidator;
import lorekeeper.domain.validate.ValidateStringBlank;
import lorekeeper.infrastructure.llm.LlmClient;
import lorekeeper.infrastructure.llm.StructuredResponseParser;
import lorekeeper.infrastructure.mock.MockLlmClient;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(ThreadQnaStrategy.class)
@AddBeanClasses(ThreadInsightStrategy.class)
@AddBeanClasses(ThreadGlossaryStrategy.class)
@AddBeanClasses(GlossaryRecords.class)
@AddBeanClasses(RemoveSlackMarkup.class)
@AddBeanClasses(MockLlmClient.class)
@AddBeanClasses(StructuredResponseParser.class)
@AddBeanClasses(GetFirstMarkdownBlock.class)
@AddBeanClasses(GetJsonObject.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(ModelConfig.class)
@AddBeanClasses(SemanticRecordValidator.class)
@AddBeanClasses(ValidateStringBlank.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
class ThreadStrategiesTest {

    @Inject
    private ThreadQnaStrategy qnaStrategy;

    @Inject
    private ThreadInsightStrategy insightStrategy;

    @Inject
    private ThreadGlossaryStrategy glossaryStrategy;

    @Inject
    private MockLlmClient mockLlmClient;

    @Produces
    @Preferred
    @ApplicationScoped
    public LlmClient produceLlmClient(final MockLlmClient llmClient) {
        return llmClient;
    }

    @Test
    void testQnaNeedsTwoMessages() {
        mockLlmClient.setMockResponse("""
                {"is_valuable": true, "question": "How do I deploy?", "answer": "Run the pipeline"}""");

        final ThreadItem item = new ThreadItem("C123", "1700000000.000100",
                List.of(new ThreadMessage("How do I deploy?", "alice", "1700000000.000100", null)));

        assertTrue(qnaStrategy.process(item).isEmpty());
        assertEquals(0, mockLlmClient.getCallCount());
    }

    @Test
    void testQnaRecord() {
        mockLlmClient.setMockResponse("""
                ```json
                {"is_valuable": true, "question": "How do I deploy?", "answer": "Run the deploy pipeline", "keywords": ["deploy", " ", "pipeline"]}
                ```""");

        final List<SemanticRecord> records = qnaStrategy.process(deployThread());

        assertEquals(1, records.size());
        final SemanticRecord record = records.get(0);
        assertEquals(SemanticKind.QNA, record.kind());
        assertEquals("How do I deploy?", record.payloadAs(QnaPayload.class).question());
        assertEquals("Run the deploy pipeline", record.payloadAs(QnaPayload.class).answer());
        assertEquals(List.of("deploy", "pipeline"), List.copyOf(record.keywords()));
        assertEquals(OriginKind.THREAD, record.provenance().originKind());
        assertEquals("C123", record.provenance().sourceId());
        assertEquals(List.of("alice", "bob"), record.provenance().authors());
    }

    @Test
    void testQnaNotValuable() {
        mockLlmClient.setMockResponse("""
                {"is_valuable": false, "question": "Lunch?", "answer": "Sure"}""");

        assertTrue(qnaStrategy.process(deployThread()).isEmpty());
        assertEquals(1, mockLlmClient.getCallCount());
    }

    @Test
    void testQnaWithBlankAnswerIsDropped() {
        mockLlmClient.setMockResponse("""
                {"is_valuable": true, "question": "How do I deploy?", "answer": " "}""");

        assertTrue(qnaStrategy.process(deployThread()).isEmpty());
    }

    @Test
    void testMalformedResponseYieldsNothing() {
        mockLlmClient.setMockResponse("I could not decide, sorry");

        assertTrue(qnaStrategy.process(deployThread()).isEmpty());
        assertTrue(insightStrategy.process(deployThread()).isEmpty());
        assertTrue(glossaryStrategy.process(deployThread()).isEmpty());
    }

    @Test
    void testServiceFailureYieldsNothing() {
        mockLlmClient.setFailure(new FailedOllama("The service is down"));

        assertTrue(qnaStrategy.process(deployThread()).isEmpty());
        assertTrue(insightStrategy.process(deployThread()).isEmpty());
        assertTrue(glossaryStrategy.process(deployThread()).isEmpty());
    }

    @Test
    void testSlackMarkupRemovedFromPrompt() {
        final ThreadItem item = new ThreadItem("C123", "1700000000.000100", List.of(
                new ThreadMessage("<@U123|alice> where is the runbook?", "carol", "1700000000.000100", null),
                new ThreadMessage("See <https://wiki.example.org/runbook|the runbook>", "bob", "1700000001.000100", null)));

        qnaStrategy.process(item);

        final String prompt = mockLlmClient.getPrompts().get(0);
        assertTrue(prompt.contains("@alice where is the runbook?"));
        assertTrue(prompt.contains("the runbook (https://wiki.example.org/runbook)"));
        assertFalse(prompt.contains("<@U123"));
    }

    @Test
    void testInsightTypes() {
        mockLlmClient.setMockResponse("""
                {"insights": [
                    {"type": "insight", "content": "Deploys are slow on Fridays", "keywords": ["deploy"]},
                    {"type": "Feedback", "content": "The pipeline UI is confusing"},
                    {"type": "reference", "content": "https://wiki.example.org/runbook", "reference_type": "doc"},
                    {"type": "rumour", "content": "Staging is rebuilt nightly"},
                    {"type": "insight", "content": ""}
                ]}""");

        final List<SemanticRecord> records = insightStrategy.process(deployThread());

        assertEquals(4, records.size());
        assertEquals(SemanticKind.INSIGHT, records.get(0).kind());
        assertEquals(SemanticKind.FEEDBACK, records.get(1).kind());
        assertEquals(SemanticKind.REFERENCE, records.get(2).kind());
        assertEquals("doc", records.get(2).payloadAs(ReferencePayload.class).referenceKind());
        assertEquals(SemanticKind.INSIGHT, records.get(3).kind());
    }

    @Test
    void testLowConfidenceGlossaryNeedsReview() {
        mockLlmClient.setMockResponse("""
                {"terms": [
                    {"term": "CAB", "definition": "Change advisory board", "category": "service", "confidence": "low", "needs_review": false},
                    {"term": "SLA", "definition": "Service level agreement", "confidence": "high", "keywords": ["support"]},
                    {"term": " ", "definition": "Nothing"}
                ]}""");

        final List<SemanticRecord> records = glossaryStrategy.process(deployThread());

        assertEquals(2, records.size());

        final GlossaryPayload cab = records.get(0).payloadAs(GlossaryPayload.class);
        assertEquals("CAB", cab.term());
        assertTrue(cab.needsReview());
        assertTrue(records.get(0).keywords().contains("cab"));

        final GlossaryPayload sla = records.get(1).payloadAs(GlossaryPayload.class);
        assertFalse(sla.needsReview());
        assertEquals("general", sla.termCategory());
        assertTrue(records.get(1).keywords().containsAll(List.of("sla", "support")));
    }

    private ThreadItem deployThread() {
        return new ThreadItem("C123", "1700000000.000100", List.of(
                new ThreadMessage("How do I deploy?", "alice", "1700000000.000100", "https://chat.example.org/p1"),
                new ThreadMessage("Run the deploy pipeline", "bob", "1700000001.000100", "https://chat.example.org/p2")));
    }
}
