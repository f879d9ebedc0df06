package lorekeeper.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticRecordTest {

    private final Provenance provenance = Provenance.documentSection("doc-1", "Runbook", "Deploying");

    @Test
    void testPayloadMustMatchKind() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticRecord(
                SemanticKind.QNA, new ContentPayload("Not a question"), List.of(), provenance));
        assertThrows(IllegalArgumentException.class, () -> new SemanticRecord(
                SemanticKind.INSIGHT, new QnaPayload("Q", "A"), List.of(), provenance));
    }

    @Test
    void testKeywordsAreCleaned() {
        final SemanticRecord record = SemanticRecord.content(SemanticKind.INSIGHT, "Content", List.of(" deploy ", "", "staging"), provenance);
        assertEquals(Set.of("deploy", "staging"), record.keywords());
        assertThrows(UnsupportedOperationException.class, () -> record.keywords().add("other"));
    }

    @Test
    void testStoredCopyHasSameContent() {
        final SemanticRecord record = SemanticRecord.qna("Q", "A", List.of("k"), provenance);
        final SemanticRecord stored = record.stored(7L, Instant.now());

        assertNull(record.id());
        assertEquals(7L, stored.id());
        assertTrue(record.sameContent(stored));
    }

    @Test
    void testKindLookup() {
        assertEquals(SemanticKind.QNA, SemanticKind.fromValue("qa"));
        assertEquals(SemanticKind.QNA, SemanticKind.fromValue("QnA"));
        assertEquals(SemanticKind.GLOSSARY, SemanticKind.fromValue("Glossary"));
        assertTrue(SemanticKind.tryFromValue("recipe").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> SemanticKind.fromValue("recipe"));
    }
}
