package me.golemcore.agentkernel.domain.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSchemaGrammarTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonSchemaGrammar grammar = new JsonSchemaGrammar(objectMapper);

    @Test
    void shouldBuildArraySchemaWithOneVariantPerTool() throws Exception {
        GrammarArtifact artifact = grammar.build(List.of(
                ToolSchema.simple("add", "Adds"),
                ToolSchema.simple("ping", "Ping")));

        JsonNode schema = objectMapper.readTree(artifact.getDocument());
        assertEquals("array", schema.get("type").asText());
        assertEquals(1, schema.get("minItems").asInt());
        JsonNode variants = schema.get("items").get("anyOf");
        assertEquals(2, variants.size());
        assertEquals("add", variants.get(0).get("properties").get("name").get("const").asText());
        assertFalse(variants.get(0).get("additionalProperties").asBoolean());
        assertTrue(artifact.getTriggers().isEmpty());
    }

    @Test
    void shouldNestSchemaUnderJsonSchemaKey() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));

        @SuppressWarnings("unchecked")
        Map<String, Object> outputs = (Map<String, Object>) artifact.getPayload().get("structured_outputs");
        assertEquals("json", outputs.get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> json = (Map<String, Object>) outputs.get("json");
        assertTrue(json.containsKey("json_schema"));
    }

    @Test
    void shouldRoundTripMultipleCalls() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));
        List<Message.ToolCall> calls = List.of(
                Message.ToolCall.create("add", Map.of("x", 1)),
                Message.ToolCall.create("add", Map.of("x", 2)));

        List<ParsedCall> parsed = grammar.parse(artifact, grammar.render(calls));

        assertEquals(2, parsed.size());
        assertEquals(Map.of("x", 1), parsed.get(0).call().getArguments());
        assertEquals(Map.of("x", 2), parsed.get(1).call().getArguments());
    }

    @Test
    void shouldRecoverArrayWrappedInProse() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));

        List<ParsedCall> parsed = grammar.parse(artifact,
                "Sure, here you go: [{\"name\": \"add\", \"arguments\": {\"x\": \"]\"}}] hope it helps");

        assertEquals(1, parsed.size());
        assertEquals("]", parsed.get(0).call().getArguments().get("x"));
    }

    @Test
    void shouldAcceptSingleObjectAndStringArguments() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));

        List<ParsedCall> parsed = grammar.parse(artifact,
                "{\"name\": \"add\", \"arguments\": \"{\\\"x\\\": 4}\"}");

        assertEquals(1, parsed.size());
        assertEquals(Map.of("x", 4), parsed.get(0).call().getArguments());
    }

    @Test
    void shouldTreatMissingArgumentsAsEmpty() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("ping", "Ping")));

        List<ParsedCall> parsed = grammar.parse(artifact, "[{\"name\": \"ping\"}]");

        assertTrue(parsed.get(0).call().getArguments().isEmpty());
    }

    @Test
    void shouldReturnNoCallsWhenOutputHasNoJson() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));

        List<ParsedCall> parsed = grammar.parse(artifact, "I cannot help with that");

        assertTrue(parsed.isEmpty());
    }

    @Test
    void shouldFailEntriesWithoutName() {
        GrammarArtifact artifact = grammar.build(List.of(ToolSchema.simple("add", "Adds")));

        List<ParsedCall> parsed = grammar.parse(artifact, "[{\"arguments\": {}}, {\"name\": \"add\"}]");

        assertEquals(2, parsed.size());
        assertTrue(parsed.get(0).isError());
        assertEquals("call entry has no tool name", parsed.get(0).error().reason());
        assertFalse(parsed.get(1).isError());
    }
}
