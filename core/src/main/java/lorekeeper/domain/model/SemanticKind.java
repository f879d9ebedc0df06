package lorekeeper.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of semantic record kinds. Each kind is bound to the payload type it carries.
 */
public enum SemanticKind {
    QNA("qna", QnaPayload.class),
    INSIGHT("insight", ContentPayload.class),
    FEEDBACK("feedback", ContentPayload.class),
    REFERENCE("reference", ReferencePayload.class),
    INSTRUCTION("instruction", ContentPayload.class),
    GLOSSARY("glossary", GlossaryPayload.class);

    private final String value;
    private final Class<? extends SemanticPayload> payloadType;

    SemanticKind(final String value, final Class<? extends SemanticPayload> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends SemanticPayload> getPayloadType() {
        return payloadType;
    }

    public boolean accepts(final SemanticPayload payload) {
        return payloadType.isInstance(payload);
    }

    /**
     * Case-insensitive lookup by value or enum name. "qa" is accepted for Q&amp;A records.
     */
    public static Optional<SemanticKind> tryFromValue(@Nullable final String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }

        final String normalized = value.trim().toLowerCase(Locale.ROOT);

        if ("qa".equals(normalized)) {
            return Optional.of(QNA);
        }

        return Arrays.stream(values())
                .filter(kind -> kind.value.equals(normalized) || kind.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static SemanticKind fromValue(final String value) {
        return tryFromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown semantic kind: " + value));
    }
}
