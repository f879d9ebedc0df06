package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lorekeeper.domain.model.Confidence;
import lorekeeper.domain.model.GlossaryPayload;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A term as described by the model. The confidence is read leniently, so an unexpected value becomes LOW.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GlossaryResponseItem(@Nullable String term,
                                   @Nullable String definition,
                                   @Nullable String category,
                                   @Nullable String confidence,
                                   @JsonProperty("needs_review") @Nullable Boolean needsReview,
                                   @JsonProperty("alternative_definitions") @Nullable List<String> alternativeDefinitions,
                                   @JsonProperty("domain_hints") @Nullable List<String> domainHints,
                                   @Nullable List<String> keywords) {
    public GlossaryPayload toPayload() {
        return new GlossaryPayload(
                term,
                definition,
                category,
                Confidence.fromValue(confidence),
                Boolean.TRUE.equals(needsReview),
                alternativeDefinitions,
                domainHints == null ? null : new LinkedHashSet<>(domainHints));
    }

    public List<String> keywordList() {
        return Objects.requireNonNullElse(keywords, List.of());
    }
}
