package lorekeeper.infrastructure.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import lorekeeper.domain.json.JsonDeserializerJackson;
import lorekeeper.domain.logger.Loggers;
import lorekeeper.domain.sanitize.GetFirstMarkdownBlock;
import lorekeeper.domain.sanitize.GetJsonObject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(StructuredResponseParser.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(GetFirstMarkdownBlock.class)
@AddBeanClasses(GetJsonObject.class)
@AddBeanClasses(Loggers.class)
public class StructuredResponseParserTest {

    @Inject
    StructuredResponseParser parser;

    @Test
    void testPlainJson() {
        final Answer answer = parser.parse("{\"question\": \"Q?\", \"answer\": \"A.\", \"keywords\": [\"k\"]}", Answer.class);

        assertEquals("Q?", answer.question());
        assertEquals(List.of("k"), answer.keywords());
    }

    @Test
    void testFencedJsonWithUnknownFields() {
        final Answer answer = parser.parse("```json\n{\"question\": \"Q?\", \"extra\": 1}\n```", Answer.class);

        assertEquals("Q?", answer.question());
        assertNull(answer.answer());
    }

    @Test
    void testJsonWithChatter() {
        final Answer answer = parser.parse("Sure, here it is: {\"answer\": \"A.\"} Let me know!", Answer.class);

        assertEquals("A.", answer.answer());
    }

    @Test
    void testUnparseableIsEmpty() {
        assertEquals(new Answer(null, null, null), parser.parse("I can't help with that", Answer.class));
        assertEquals(new Answer(null, null, null), parser.parse("{\"question\": ", Answer.class));
        assertEquals(new Answer(null, null, null), parser.parse(null, Answer.class));
        assertEquals(new Answer(null, null, null), parser.parse("", Answer.class));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Answer(String question, String answer, List<String> keywords) {
    }
}
