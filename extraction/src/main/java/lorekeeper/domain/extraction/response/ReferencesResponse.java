package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferencesResponse(@Nullable List<ReferencesResponseItem> references) {
    public List<ReferencesResponseItem> referenceList() {
        return Objects.requireNonNullElse(references, List.<ReferencesResponseItem>of())
                .stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
