package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadMessage(String text, String author, String timestamp, @Nullable String permalink) {
    public static final String UNKNOWN_AUTHOR = "Unknown";

    public ThreadMessage {
        text = StringUtils.defaultString(text);
        author = StringUtils.defaultIfBlank(author, UNKNOWN_AUTHOR);
        timestamp = StringUtils.defaultString(timestamp);
    }
}
