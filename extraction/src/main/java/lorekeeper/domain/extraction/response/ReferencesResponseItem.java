package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A reference is either free text in content, or a title, url and description.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferencesResponseItem(@Nullable String content,
                                     @JsonProperty("reference_type") @Nullable String referenceType,
                                     @Nullable String title,
                                     @Nullable String url,
                                     @Nullable String description,
                                     @Nullable List<String> keywords) {
    public String fullContent() {
        if (StringUtils.isNotBlank(content)) {
            return content.trim();
        }

        return Stream.of(title, url, description)
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .collect(Collectors.joining(" - "));
    }

    public List<String> keywordList() {
        return Objects.requireNonNullElse(keywords, List.of());
    }
}
