package lorekeeper.domain.sanitize;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns chat markup into plain text: user mentions become @mentions, links keep their label (or the url), channel
 * references keep their name, and emphasis markers are dropped.
 */
@ApplicationScoped
@Identifier("removeSlackMarkup")
public class RemoveSlackMarkup implements SanitizeDocument {
    private static final Pattern USER_MENTION = Pattern.compile("<@([A-Z0-9]+)(\\|([^>]+))?>");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("<#[A-Z0-9]+\\|([^>]+)>");
    private static final Pattern LABELLED_LINK = Pattern.compile("<(https?://[^|>]+)\\|([^>]+)>");
    private static final Pattern LINK = Pattern.compile("<(https?://[^>]+)>");
    private static final Pattern SPECIAL_MENTION = Pattern.compile("<!(here|channel|everyone)>");
    private static final Pattern BOLD = Pattern.compile("\\*([^*\\n]+)\\*");
    private static final Pattern STRIKE = Pattern.compile("~([^~\\n]+)~");

    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isEmpty(document)) {
            return document;
        }

        String result = USER_MENTION.matcher(document).replaceAll(match ->
                Matcher.quoteReplacement("@" + StringUtils.defaultIfBlank(match.group(3), match.group(1))));
        result = CHANNEL_MENTION.matcher(result).replaceAll("#$1");
        result = LABELLED_LINK.matcher(result).replaceAll("$2 ($1)");
        result = LINK.matcher(result).replaceAll("$1");
        result = SPECIAL_MENTION.matcher(result).replaceAll("@$1");
        result = BOLD.matcher(result).replaceAll("$1");
        result = STRIKE.matcher(result).replaceAll("$1");

        return result
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&")
                .trim();
    }
}
