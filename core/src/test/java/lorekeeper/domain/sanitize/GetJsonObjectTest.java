package lorekeeper.domain.sanitize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GetJsonObjectTest {

    private final GetJsonObject getJsonObject = new GetJsonObject();

    @Test
    void testSanitizeWithChatter() {
        assertEquals("{\"a\": {\"b\": 1}}", getJsonObject.sanitize("Sure! {\"a\": {\"b\": 1}} Hope that helps."));
    }

    @Test
    void testSanitizeWithoutBraces() {
        assertEquals("no json here", getJsonObject.sanitize("no json here"));
    }

    @Test
    void testSanitizeWithReversedBraces() {
        assertEquals("} oops {", getJsonObject.sanitize("} oops {"));
    }
}
