package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A block from a document export. Blocks can nest, e.g. the items of a toggle or a list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentBlock(String type, @Nullable String text, List<DocumentBlock> children) {
    public DocumentBlock {
        type = StringUtils.defaultString(type);
        children = children == null ? List.of() : children;
    }

    public DocumentBlock(final String type, final String text) {
        this(type, text, List.of());
    }

    public boolean isHeading() {
        return type.equals("heading_1") || type.equals("heading_2") || type.equals("heading_3");
    }

    public boolean hasText() {
        return StringUtils.isNotBlank(text);
    }
}
