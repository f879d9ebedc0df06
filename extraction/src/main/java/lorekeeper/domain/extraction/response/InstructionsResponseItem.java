package lorekeeper.domain.extraction.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An instruction is either free text in content, or a title with a list of steps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstructionsResponseItem(@Nullable String content,
                                       @Nullable String title,
                                       @Nullable List<String> steps,
                                       @Nullable List<String> keywords) {
    public String fullContent() {
        if (StringUtils.isNotBlank(content)) {
            return content.trim();
        }

        final List<String> lines = new ArrayList<>();
        if (StringUtils.isNotBlank(title)) {
            lines.add(title.trim());
        }

        final List<String> cleanSteps = Objects.requireNonNullElse(steps, List.<String>of())
                .stream()
                .filter(StringUtils::isNotBlank)
                .toList();
        for (int i = 0; i < cleanSteps.size(); ++i) {
            lines.add((i + 1) + ". " + cleanSteps.get(i).trim());
        }

        return String.join("\n", lines);
    }

    public List<String> keywordList() {
        return Objects.requireNonNullElse(keywords, List.of());
    }
}
