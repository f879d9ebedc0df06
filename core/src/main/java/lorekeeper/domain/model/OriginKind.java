package lorekeeper.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where a raw item, and the records extracted from it, came from.
 */
public enum OriginKind {
    THREAD("thread"),
    DOCUMENT_SECTION("document_section"),
    /**
     * Glossary terms first discovered by the enhancement pass rather than read from a raw item.
     */
    DERIVED("derived");

    private final String value;

    OriginKind(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<OriginKind> tryFromValue(@Nullable final String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }

        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    @JsonCreator
    public static OriginKind fromValue(final String value) {
        return tryFromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown origin kind: " + value));
    }
}
