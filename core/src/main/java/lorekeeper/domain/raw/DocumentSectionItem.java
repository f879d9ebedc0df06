package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lorekeeper.domain.model.OriginKind;
import lorekeeper.domain.model.Provenance;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;

/**
 * A titled section of a wiki-style document, holding the text of its blocks in order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentSectionItem(@JsonProperty("document_id") String documentId,
                                  @JsonProperty("document_title") String documentTitle,
                                  @JsonProperty("section_title") String sectionTitle,
                                  List<String> content) implements RawItem {
    public DocumentSectionItem {
        documentId = StringUtils.defaultString(documentId);
        documentTitle = StringUtils.defaultString(documentTitle);
        sectionTitle = StringUtils.defaultString(sectionTitle);
        content = content == null ? List.of() : content.stream().filter(Objects::nonNull).toList();
    }

    @Override
    public OriginKind originKind() {
        return OriginKind.DOCUMENT_SECTION;
    }

    @Override
    public String text() {
        return String.join(" ", content);
    }

    public Provenance provenance() {
        return Provenance.documentSection(documentId, documentTitle, sectionTitle);
    }
}
