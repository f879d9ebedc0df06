package lorekeeper.domain.sanitize;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/**
 * Trims any chatter around a JSON object, e.g. "Here is the result: {...}". Text without braces is returned unchanged.
 */
@ApplicationScoped
@Identifier("getJsonObject")
public class GetJsonObject implements SanitizeDocument {
    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isEmpty(document)) {
            return document;
        }

        final int start = document.indexOf('{');
        final int end = document.lastIndexOf('}');

        if (start < 0 || end < start) {
            return document;
        }

        return document.substring(start, end + 1);
    }
}
