package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InstructionsResponse(@Nullable List<InstructionsResponseItem> instructions) {
    public List<InstructionsResponseItem> instructionList() {
        return Objects.requireNonNullElse(instructions, List.<InstructionsResponseItem>of())
                .stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
