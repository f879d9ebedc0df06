package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QnaResponse(@JsonProperty("is_valuable") @Nullable Boolean isValuable,
                          @Nullable String question,
                          @Nullable String answer,
                          @Nullable List<String> keywords) {
    /**
     * A missing flag means the model did not say the pair is worth keeping.
     */
    public boolean valuable() {
        return Boolean.TRUE.equals(isValuable);
    }

    public List<String> keywordList() {
        return Objects.requireNonNullElse(keywords, List.of());
    }
}
