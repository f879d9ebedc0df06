package lorekeeper.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * The body shared by insights, feedback and instructions.
 */
public record ContentPayload(String content) implements SemanticPayload {
    public ContentPayload {
        content = StringUtils.trimToEmpty(content);
    }

    @Override
    public Map<String, String> metadata() {
        return Map.of();
    }
}
