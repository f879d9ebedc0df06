package lorekeeper.domain.sanitize;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Models like to wrap JSON in a fenced code block. This returns the content of the first block, or the document as is
 * if there is no block.
 */
@ApplicationScoped
@Identifier("getFirstMarkdownBlock")
public class GetFirstMarkdownBlock implements SanitizeDocument {
    private static final Pattern MARKDOWN_BLOCK_REGEX = Pattern.compile("```[a-zA-Z]*\\s*\n(.*?)\n?```", Pattern.DOTALL);

    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isEmpty(document)) {
            return document;
        }

        final Matcher matcher = MARKDOWN_BLOCK_REGEX.matcher(document.trim());

        if (matcher.find()) {
            return matcher.group(1).trim();
        }

        return document.trim();
    }
}
