package me.golemcore.agentkernel.domain.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonScannerTest {

    @Test
    void shouldSkipBracesInsideStrings() {
        String text = "{\"a\": \"}{\", \"b\": [1, 2]} tail";

        assertEquals(text.indexOf(" tail"), JsonScanner.findValueEnd(text, 0));
    }

    @Test
    void shouldHandleEscapedQuotes() {
        String text = "{\"a\": \"say \\\"}\\\"\"}";

        assertEquals(text.length(), JsonScanner.findValueEnd(text, 0));
    }

    @Test
    void shouldReturnNegativeForUnterminatedObject() {
        assertEquals(-1, JsonScanner.findValueEnd("{\"a\": 1", 0));
    }

    @Test
    void shouldFindFirstContainer() {
        assertEquals(5, JsonScanner.findFirstContainerStart("text [1]"));
        assertEquals(-1, JsonScanner.findFirstContainerStart("no json"));
    }

    @Test
    void shouldEscapeAndUnescapeGrammarLiterals() {
        String raw = "a\"b\\c\nd\te";

        String escaped = GrammarEscapes.escapeLiteral(raw);

        assertEquals("a\\\"b\\\\c\\nd\\te", escaped);
        assertEquals(raw, GrammarEscapes.unescapeLiteral(escaped));
        assertEquals("\"x\\\"\"", GrammarEscapes.quote("x\""));
    }
}
