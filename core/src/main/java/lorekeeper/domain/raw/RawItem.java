package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lorekeeper.domain.model.OriginKind;

/**
 * An item handed over by the raw data provider, already fetched and assembled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "origin")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ThreadItem.class, name = "thread"),
        @JsonSubTypes.Type(value = DocumentSectionItem.class, name = "document_section")
})
public interface RawItem {
    @JsonIgnore
    OriginKind originKind();

    /**
     * All the text in the item, used when a prompt needs background context.
     */
    @JsonIgnore
    String text();
}
