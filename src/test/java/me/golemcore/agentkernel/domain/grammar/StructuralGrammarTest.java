package me.golemcore.agentkernel.domain.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.exception.GrammarSchemaException;
import me.golemcore.agentkernel.domain.model.KernelErrorKind;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StructuralGrammarTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StructuralGrammar grammar = new StructuralGrammar(objectMapper);

    private static ToolSchema addTool() {
        return ToolSchema.builder()
                .name("add")
                .description("Adds two integers")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "x", Map.of("type", "integer"),
                                "y", Map.of("type", "integer")),
                        "required", List.of("x", "y")))
                .build();
    }

    @Test
    void shouldBuildOneStructurePerTool() throws Exception {
        GrammarArtifact artifact = grammar.build(List.of(addTool(), ToolSchema.simple("ping", "Ping")));

        JsonNode tag = objectMapper.readTree(artifact.getDocument());
        assertEquals("structural_tag", tag.get("type").asText());
        assertEquals(2, tag.get("structures").size());
        assertEquals("<function=add>", tag.get("structures").get(0).get("begin").asText());
        assertEquals("</function>", tag.get("structures").get(0).get("end").asText());
        assertEquals("integer", tag.get("structures").get(0).get("schema").get("properties").get("x").get("type")
                .asText());
        assertEquals("<function=", tag.get("triggers").get(0).asText());
    }

    @Test
    void shouldSendTagAsJsonStringInPayload() {
        GrammarArtifact artifact = grammar.build(List.of(addTool()));

        @SuppressWarnings("unchecked")
        Map<String, Object> outputs = (Map<String, Object>) artifact.getPayload().get("structured_outputs");
        assertEquals("structural_tag", outputs.get("type"));
        assertInstanceOf(String.class, outputs.get("structural_tag"));
        assertEquals(artifact.getDocument(), outputs.get("structural_tag"));
    }

    @Test
    void shouldRejectUnionSchemas() {
        ToolSchema union = ToolSchema.builder()
                .name("lookup")
                .description("Union parameter")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "key", Map.of("anyOf", List.of(
                                        Map.of("type", "string"),
                                        Map.of("type", "integer"))))))
                .build();

        GrammarSchemaException error = assertThrows(GrammarSchemaException.class,
                () -> grammar.build(List.of(union)));

        assertEquals("lookup", error.getToolName());
        assertEquals(KernelErrorKind.SCHEMA, error.getKind());
        assertTrue(error.getMessage().contains("anyOf"));
    }

    @Test
    void shouldRejectTypeArrays() {
        ToolSchema union = ToolSchema.builder()
                .name("lookup")
                .description("Nullable")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of("key", Map.of("type", List.of("string", "null")))))
                .build();

        assertThrows(GrammarSchemaException.class, () -> grammar.build(List.of(union)));
    }

    @Test
    void shouldRoundTripRenderedCalls() {
        GrammarArtifact artifact = grammar.build(List.of(addTool()));
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("x", 2);
        arguments.put("y", 3);
        String text = grammar.render(List.of(Message.ToolCall.create("add", arguments)));

        List<ParsedCall> parsed = grammar.parse(artifact, text);

        assertEquals("<function=add>{\"x\":2,\"y\":3}</function>", text);
        assertEquals(1, parsed.size());
        assertEquals(Map.of("x", 2, "y", 3), parsed.get(0).call().getArguments());
    }

    @Test
    void shouldReportSchemaViolationsAsParseErrors() {
        GrammarArtifact artifact = grammar.build(List.of(addTool()));

        List<ParsedCall> parsed = grammar.parse(artifact, "<function=add>{\"x\": \"two\"}</function>");

        assertEquals(1, parsed.size());
        assertTrue(parsed.get(0).isError());
        assertTrue(parsed.get(0).error().reason().contains("$.x: expected integer"));
        assertTrue(parsed.get(0).error().reason().contains("missing required property 'y'"));
    }

    @Test
    void shouldReportNonObjectBody() {
        GrammarArtifact artifact = grammar.build(List.of(addTool()));

        List<ParsedCall> parsed = grammar.parse(artifact, "<function=add>oops</function>");

        assertEquals(1, parsed.size());
        assertTrue(parsed.get(0).isError());
        assertEquals("add", parsed.get(0).error().toolName());
    }
}
