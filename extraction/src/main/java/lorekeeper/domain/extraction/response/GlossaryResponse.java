package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GlossaryResponse(@Nullable List<GlossaryResponseItem> terms) {
    public List<GlossaryResponseItem> termList() {
        return Objects.requireNonNullElse(terms, List.<GlossaryResponseItem>of())
                .stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
