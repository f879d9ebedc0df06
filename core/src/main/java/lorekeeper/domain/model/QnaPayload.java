package lorekeeper.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public record QnaPayload(String question, String answer) implements SemanticPayload {
    public QnaPayload {
        question = StringUtils.trimToEmpty(question);
        answer = StringUtils.trimToEmpty(answer);
    }

    @Override
    public Map<String, String> metadata() {
        return Map.of("question", question);
    }
}
