package lorekeeper.domain.model;

import java.util.Map;

/**
 * The kind-specific body of a semantic record.
 */
public interface SemanticPayload {
    /**
     * The short, flat description of this payload kept next to the full content in the store.
     */
    Map<String, String> metadata();
}
