package lorekeeper.domain.model;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed fact extracted from a raw item. The id and creation time are empty until the record has been stored.
 * Records are never updated: re-extracting a source creates new records.
 */
public record SemanticRecord(@Nullable Long id,
                             SemanticKind kind,
                             SemanticPayload payload,
                             Set<String> keywords,
                             Provenance provenance,
                             @Nullable Instant createdAt) {
    public SemanticRecord {
        checkNotNull(kind, "kind must not be null");
        checkNotNull(payload, "payload must not be null");
        checkNotNull(provenance, "provenance must not be null");
        checkArgument(kind.accepts(payload),
                "A " + kind.getValue() + " record can not carry a " + payload.getClass().getSimpleName());
        keywords = cleanKeywords(keywords);
    }

    public SemanticRecord(final SemanticKind kind, final SemanticPayload payload, final Collection<String> keywords, final Provenance provenance) {
        this(null, kind, payload, keywords == null ? Set.of() : new LinkedHashSet<>(keywords), provenance, null);
    }

    public static SemanticRecord qna(final String question, final String answer, final Collection<String> keywords, final Provenance provenance) {
        return new SemanticRecord(SemanticKind.QNA, new QnaPayload(question, answer), keywords, provenance);
    }

    public static SemanticRecord content(final SemanticKind kind, final String content, final Collection<String> keywords, final Provenance provenance) {
        return new SemanticRecord(kind, new ContentPayload(content), keywords, provenance);
    }

    public static SemanticRecord reference(final String content, final String referenceKind, final Collection<String> keywords, final Provenance provenance) {
        return new SemanticRecord(SemanticKind.REFERENCE, new ReferencePayload(content, referenceKind), keywords, provenance);
    }

    public static SemanticRecord glossary(final GlossaryPayload payload, final Collection<String> keywords, final Provenance provenance) {
        return new SemanticRecord(SemanticKind.GLOSSARY, payload, keywords, provenance);
    }

    /**
     * The payload cast to the type implied by the kind.
     */
    public <T extends SemanticPayload> T payloadAs(final Class<T> clazz) {
        checkArgument(clazz.isInstance(payload), "Payload is a " + payload.getClass().getSimpleName() + ", not a " + clazz.getSimpleName());
        return clazz.cast(payload);
    }

    public SemanticRecord stored(final long newId, final Instant newCreatedAt) {
        return new SemanticRecord(newId, kind, payload, keywords, provenance, newCreatedAt);
    }

    public SemanticRecord updatePayload(final SemanticPayload newPayload) {
        return new SemanticRecord(null, kind, newPayload, keywords, provenance, null);
    }

    /**
     * Compares everything except the id and creation time assigned by the store.
     */
    public boolean sameContent(final SemanticRecord other) {
        return other != null
                && kind == other.kind
                && Objects.equals(payload, other.payload)
                && Objects.equals(keywords, other.keywords)
                && Objects.equals(provenance, other.provenance);
    }

    private static Set<String> cleanKeywords(@Nullable final Set<String> keywords) {
        if (keywords == null) {
            return Set.of();
        }

        final Set<String> cleaned = new LinkedHashSet<>();
        for (final String keyword : keywords) {
            if (StringUtils.isNotBlank(keyword)) {
                cleaned.add(keyword.trim());
            }
        }
        return Collections.unmodifiableSet(cleaned);
    }
}
