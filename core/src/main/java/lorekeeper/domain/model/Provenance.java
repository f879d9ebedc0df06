package lorekeeper.domain.model;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Where a record came from. Used for traceability and filtering only.
 *
 * @param originKind The kind of raw item
 * @param sourceId   The channel or document id
 * @param locator    The thread timestamp or section title within the source
 * @param title      A human-readable title for the source, if it has one
 * @param authors    Human-readable author names, e.g. the questioner and answerer of a thread
 * @param permalinks Links back to the original messages
 */
public record Provenance(OriginKind originKind,
                         String sourceId,
                         @Nullable String locator,
                         @Nullable String title,
                         List<String> authors,
                         List<String> permalinks) {
    public Provenance {
        Objects.requireNonNull(originKind, "originKind must not be null");
        sourceId = StringUtils.trimToEmpty(sourceId);
        authors = authors == null ? List.of() : authors.stream().filter(StringUtils::isNotBlank).toList();
        permalinks = permalinks == null ? List.of() : permalinks.stream().filter(StringUtils::isNotBlank).toList();
    }

    public static Provenance thread(final String channel, final String threadId, final List<String> authors, final List<String> permalinks) {
        return new Provenance(OriginKind.THREAD, channel, threadId, null, authors, permalinks);
    }

    public static Provenance documentSection(final String documentId, final String documentTitle, final String sectionTitle) {
        return new Provenance(OriginKind.DOCUMENT_SECTION, documentId, sectionTitle, documentTitle, List.of(), List.of());
    }

    public static Provenance derived(final String description) {
        return new Provenance(OriginKind.DERIVED, "enhancement", null, description, List.of(), List.of());
    }
}
