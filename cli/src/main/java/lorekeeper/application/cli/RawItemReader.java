package lorekeeper.application.cli;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lorekeeper.domain.json.JsonDeserializer;
import lorekeeper.domain.raw.DocumentPage;
import lorekeeper.domain.raw.DocumentSectioner;
import lorekeeper.domain.raw.RawItem;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reads the raw items to extract from a JSON file. The file holds either items in the provider's shape (objects with
 * an "origin"), or document page exports that are split into sections here.
 */
@ApplicationScoped
public class RawItemReader {
    private static final String ORIGIN = "origin";

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private DocumentSectioner documentSectioner;

    public List<RawItem> read(final Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public List<RawItem> parse(final String json) {
        checkArgument(StringUtils.isNotBlank(json), "The input file is empty");

        if (json.trim().startsWith("[")) {
            final List<Object> elements = jsonDeserializer.deserializeCollection(json, Object.class);

            if (elements.stream().allMatch(element -> element instanceof Map<?, ?> map && map.containsKey(ORIGIN))) {
                return jsonDeserializer.deserializeCollection(json, RawItem.class);
            }

            return new ArrayList<>(documentSectioner.getSections(
                    jsonDeserializer.deserializeCollection(json, DocumentPage.class)));
        }

        if (jsonDeserializer.deserializeMap(json, String.class, Object.class).containsKey(ORIGIN)) {
            return List.of(jsonDeserializer.deserialize(json, RawItem.class));
        }

        return new ArrayList<>(documentSectioner.getSections(jsonDeserializer.deserialize(json, DocumentPage.class)));
    }
}
