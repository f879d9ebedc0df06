package lorekeeper.infrastructure.ollama.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/**
 * The body of a call to /api/generate. Setting the format to "json" constrains the model to a single JSON object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaGenerateBody(String model,
                                 String prompt,
                                 Boolean stream,
                                 @Nullable String format,
                                 OllamaGenerateBodyOptions options) {
    public static final String JSON_FORMAT = "json";

    public OllamaGenerateBody sanitizedCopy() {
        return new OllamaGenerateBody(StringUtils.trim(model), StringUtils.trim(prompt), stream, format, options);
    }
}
