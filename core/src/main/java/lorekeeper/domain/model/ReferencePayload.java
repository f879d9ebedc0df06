package lorekeeper.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * A pointer to something outside the conversation. The reference kind is free text, e.g. link, code or doc.
 */
public record ReferencePayload(String content, String referenceKind) implements SemanticPayload {
    public static final String DEFAULT_REFERENCE_KIND = "link";

    public ReferencePayload {
        content = StringUtils.trimToEmpty(content);
        referenceKind = StringUtils.defaultIfBlank(StringUtils.trim(referenceKind), DEFAULT_REFERENCE_KIND).toLowerCase(Locale.ROOT);
    }

    @Override
    public Map<String, String> metadata() {
        return Map.of("reference_kind", referenceKind);
    }
}
