package me.golemcore.agentkernel.domain.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscapedArgumentsParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Map<String, Object> parse(String text) {
        return new EscapedArgumentsParser(text, 0, objectMapper).readObject();
    }

    @Test
    void shouldReadEscapedStringsAndBareLiterals() {
        Map<String, Object> args = parse("{location:<escape>London, UK<escape>,days:3,ratio:0.5,metric:true}");

        assertEquals("London, UK", args.get("location"));
        assertEquals(3L, args.get("days"));
        assertEquals(0.5, args.get("ratio"));
        assertEquals(Boolean.TRUE, args.get("metric"));
    }

    @Test
    void shouldReadNestedObjectsAndArrays() {
        Map<String, Object> args = parse("{filter:{tags:[<escape>a<escape>,<escape>b<escape>]},limit:null}");

        assertEquals(Map.of("tags", List.of("a", "b")), args.get("filter"));
        assertTrue(args.containsKey("limit"));
        assertNull(args.get("limit"));
    }

    @Test
    void shouldAcceptPlainJson() {
        Map<String, Object> args = parse("{\"query\": \"x \\\"y\\\"\", \"n\": 2}");

        assertEquals("x \"y\"", args.get("query"));
        assertEquals(2L, args.get("n"));
    }

    @Test
    void shouldReportPositionOfMalformedInput() {
        EscapedArgumentsParser parser = new EscapedArgumentsParser("{a:<escape>open", 0, objectMapper);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, parser::readObject);
        assertTrue(error.getMessage().contains("unterminated"));
    }

    @Test
    void shouldStopAfterClosingBrace() {
        EscapedArgumentsParser parser = new EscapedArgumentsParser("{x:1}<end>", 0, objectMapper);

        parser.readObject();

        assertEquals(5, parser.position());
    }

    @Test
    void shouldRenderWhatItParses() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("city", "Paris, FR");
        args.put("days", 2L);
        args.put("tags", List.of("x"));

        String rendered = EscapedArgumentsParser.render(args);

        assertEquals("{city:<escape>Paris, FR<escape>,days:2,tags:[<escape>x<escape>]}", rendered);
        assertEquals(args, parse(rendered));
    }
}
