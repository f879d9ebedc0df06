package lorekeeper.domain.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Filters for retrieving records. Every filter is optional and filters are combined with AND. Keywords match if any
 * one of them matches, ignoring case. The creation time range is inclusive at both ends.
 */
public record SemanticQuery(@Nullable SemanticKind kind,
                            List<String> keywords,
                            @Nullable OriginKind originKind,
                            @Nullable Instant createdFrom,
                            @Nullable Instant createdTo) {
    public SemanticQuery {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static SemanticQuery all() {
        return new SemanticQuery(null, List.of(), null, null, null);
    }

    public SemanticQuery withKind(@Nullable final SemanticKind newKind) {
        return new SemanticQuery(newKind, keywords, originKind, createdFrom, createdTo);
    }

    public SemanticQuery withKeywords(final List<String> newKeywords) {
        return new SemanticQuery(kind, newKeywords, originKind, createdFrom, createdTo);
    }

    public SemanticQuery withOriginKind(@Nullable final OriginKind newOriginKind) {
        return new SemanticQuery(kind, keywords, newOriginKind, createdFrom, createdTo);
    }

    public SemanticQuery withCreatedBetween(@Nullable final Instant from, @Nullable final Instant to) {
        return new SemanticQuery(kind, keywords, originKind, from, to);
    }
}
