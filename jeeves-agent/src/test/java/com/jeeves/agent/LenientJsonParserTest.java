package com.jeeves.agent;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LenientJsonParserTest {

    private final LenientJsonParser parser = new LenientJsonParser();

    @Test
    void parse_plainObject() {
        assertEquals(Map.of("verdict", "ok"), parser.parse("{\"verdict\": \"ok\"}").orElseThrow());
    }

    @Test
    void parse_objectEmbeddedInProse() {
        String text = "Sure! Here is the plan: {\"steps\": [{\"tool\": \"search\"}]} Let me know.";
        Map<String, Object> parsed = parser.parse(text).orElseThrow();
        assertTrue(parsed.containsKey("steps"));
    }

    @Test
    void parse_codeFence() {
        String text = """
                ```json
                { "intent": "weather", "confidence": 0.9 }
                ```
                """;
        assertEquals("weather", parser.parse(text).orElseThrow().get("intent"));
    }

    @Test
    void parse_skipsBrokenCandidateAndBracesInsideStrings() {
        String text = "draft {not json} final {\"note\": \"use {braces} freely\", \"n\": 1}";
        Map<String, Object> parsed = parser.parse(text).orElseThrow();
        assertEquals("use {braces} freely", parsed.get("note"));
        assertEquals(1, parsed.get("n"));
    }

    @Test
    void parse_emptyWhenNoObject() {
        assertTrue(parser.parse("I cannot help with that.").isEmpty());
        assertTrue(parser.parse("[1, 2, 3]").isEmpty());
        assertTrue(parser.parse("{ unterminated").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void matchingBrace_respectsEscapedQuotes() {
        String text = "{\"a\": \"x\\\"}\"}";
        assertEquals(text.length() - 1, LenientJsonParser.matchingBrace(text, 0));
    }
}
