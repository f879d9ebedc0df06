package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightsResponse(@Nullable List<InsightsResponseItem> insights) {
    public List<InsightsResponseItem> insightList() {
        return Objects.requireNonNullElse(insights, List.<InsightsResponseItem>of())
                .stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
