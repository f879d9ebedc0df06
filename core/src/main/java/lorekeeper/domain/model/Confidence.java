package lorekeeper.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * How much a glossary definition can be trusted. The declaration order is the total order: LOW &lt; MEDIUM &lt; HIGH.
 */
public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Confidence(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isHigherThan(final Confidence other) {
        return compareTo(other) > 0;
    }

    public boolean isAtMost(final Confidence other) {
        return compareTo(other) <= 0;
    }

    /**
     * Anything that is not a recognised level is treated as LOW, so an unparseable value always ends up reviewed.
     */
    @JsonCreator
    public static Confidence fromValue(@Nullable final String value) {
        if (StringUtils.isBlank(value)) {
            return LOW;
        }

        return Arrays.stream(values())
                .filter(confidence -> confidence.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(LOW);
    }
}
