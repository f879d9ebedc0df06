package lorekeeper.infrastructure.llm;

import io.smallrye.common.annotation.Identifier;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.json.JsonDeserializer;
import lorekeeper.domain.sanitize.SanitizeDocument;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps the text returned by a model onto a response type. Models don't always honour a request for JSON, so any text
 * that can't be parsed is treated as an empty object.
 */
@ApplicationScoped
public class StructuredResponseParser {
    private static final String EMPTY_OBJECT = "{}";

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    @Identifier("getFirstMarkdownBlock")
    private SanitizeDocument getFirstMarkdownBlock;

    @Inject
    @Identifier("getJsonObject")
    private SanitizeDocument getJsonObject;

    @Inject
    private Logger logger;

    public <T> T parse(@Nullable final String response, final Class<T> clazz) {
        return Try.of(() -> getFirstMarkdownBlock.sanitize(response))
                .map(getJsonObject::sanitize)
                .filter(StringUtils::isNotBlank)
                .mapTry(json -> jsonDeserializer.deserialize(json, clazz))
                .filter(Objects::nonNull)
                .onFailure(ex -> logger.warning("Could not parse the response as " + clazz.getSimpleName() + ", treating it as empty"))
                .onFailure(ex -> logger.fine("Unparseable response: " + response))
                .getOrElse(() -> empty(clazz));
    }

    public <T> T empty(final Class<T> clazz) {
        return jsonDeserializer.deserialize(EMPTY_OBJECT, clazz);
    }
}
