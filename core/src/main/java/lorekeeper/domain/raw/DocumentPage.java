package lorekeeper.domain.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * A whole document as exported by the provider, before it is split into sections.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentPage(String id, String title, List<DocumentBlock> blocks) {
    public DocumentPage {
        id = StringUtils.defaultString(id);
        title = StringUtils.defaultString(title);
        blocks = blocks == null ? List.of() : blocks;
    }
}
