package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.Provenance;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A conversation thread. The messages are in the order they were posted, so the first one usually asks something.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadItem(String channel,
                         @JsonProperty("thread_id") String threadId,
                         List<ThreadMessage> messages) implements RawItem {
    public ThreadItem {
        channel = StringUtils.defaultString(channel);
        threadId = StringUtils.defaultString(threadId);
        messages = messages == null ? List.of() : messages.stream().filter(Objects::nonNull).toList();
    }

    @Override
    public OriginKind originKind() {
        return OriginKind.THREAD;
    }

    @Override
    public String text() {
        return messages.stream()
                .map(ThreadMessage::text)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Provenance naming the given messages' authors and links.
     */
    public Provenance provenance(final List<ThreadMessage> sourceMessages) {
        return Provenance.thread(
                channel,
                threadId,
                sourceMessages.stream().map(ThreadMessage::author).toList(),
                sourceMessages.stream().map(ThreadMessage::permalink).filter(StringUtils::isNotBlank).toList());
    }

    public Provenance provenance() {
        return provenance(messages);
    }
}
