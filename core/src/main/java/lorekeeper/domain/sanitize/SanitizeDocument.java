package lorekeeper.domain.sanitize;

import org.jspecify.annotations.Nullable;

/**
 * Defines a service for cleaning up a piece of text before it is used.
 */
public interface SanitizeDocument {
    /**
     * Sanitize the document.
     *
     * @param document The source document
     * @return The sanitized document
     */
    @Nullable String sanitize(@Nullable String document);
}
