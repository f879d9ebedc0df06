package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * @param type One of insight, feedback or reference. Anything else is read as an insight.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightsResponseItem(@Nullable String type,
                                   @Nullable String content,
                                   @Nullable List<String> keywords,
                                   @JsonProperty("reference_type") @Nullable String referenceType) {
    public List<String> keywordList() {
        return Objects.requireNonNullElse(keywords, List.of());
    }
}
