package lorekeeper.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lorekeeper.domain.exceptions.DeserializationFailed;
import lorekeeper.domain.exceptions.SerializationFailed;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    @Inject
    private Instance<SimpleModule> modules;

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object object) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.readValue(json, clazz))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public <U, V> Map<U, V> deserializeMap(final String json, final Class<U> key, final Class<V> value) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.<Map<U, V>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructMapType(Map.class, key, value)))
                .onFailure(ex -> logger.fine("Failed to deserialize map of type " + key.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public <U> List<U> deserializeCollection(final String json, final Class<U> value) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.<List<U>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructCollectionType(List.class, value)))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    private ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        if (modules != null) {
            objectMapper.registerModules(modules);
        }
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new BlackbirdModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return objectMapper;
    }
}
