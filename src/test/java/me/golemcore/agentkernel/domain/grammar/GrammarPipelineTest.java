package me.golemcore.agentkernel.domain.grammar;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.exception.GrammarSchemaException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GrammarPipelineTest {

    private final GrammarPipeline pipeline = GrammarPipeline.standard(new ObjectMapper());

    @Test
    void shouldSupportAllStandardStrategies() {
        for (GrammarStrategy strategy : GrammarStrategy.values()) {
            assertTrue(pipeline.supports(strategy), strategy.getValue());
        }
    }

    @Test
    void shouldReturnNullForNoneStrategyOrEmptyTools() {
        assertNull(pipeline.build(List.of(ToolSchema.simple("add", "Adds")), GrammarStrategy.NONE));
        assertNull(pipeline.build(List.of(), GrammarStrategy.TAGGED_TEXT));
    }

    @Test
    void shouldRejectDuplicateToolNames() {
        List<ToolSchema> tools = List.of(ToolSchema.simple("add", "One"), ToolSchema.simple("add", "Two"));

        GrammarSchemaException error = assertThrows(GrammarSchemaException.class,
                () -> pipeline.build(tools, GrammarStrategy.JSON_SCHEMA));
        assertEquals("add", error.getToolName());
    }

    @Test
    void shouldRejectBlankToolNames() {
        List<ToolSchema> tools = List.of(ToolSchema.simple(" ", "Blank"));

        assertThrows(GrammarSchemaException.class, () -> pipeline.build(tools, GrammarStrategy.TAGGED_TEXT));
    }

    @Test
    void shouldRoundTripThroughEveryConstrainedStrategy() {
        List<ToolSchema> tools = List.of(ToolSchema.simple("echo", "Echo"));
        List<Message.ToolCall> calls = List.of(Message.ToolCall.create("echo", Map.of("text", "a\nb")));

        for (GrammarStrategy strategy : List.of(GrammarStrategy.TAGGED_TEXT, GrammarStrategy.STRUCTURAL,
                GrammarStrategy.JSON_SCHEMA)) {
            GrammarArtifact artifact = pipeline.build(tools, strategy);
            List<ParsedCall> parsed = pipeline.parse(artifact, pipeline.render(strategy, calls));

            assertEquals(1, parsed.size(), strategy.getValue());
            assertEquals("echo", parsed.get(0).call().getName());
            assertEquals("a\nb", parsed.get(0).call().getArguments().get("text"));
        }
    }

    @Test
    void shouldParseNothingWithoutArtifactOrText() {
        GrammarArtifact artifact = pipeline.build(List.of(ToolSchema.simple("add", "Adds")),
                GrammarStrategy.TAGGED_TEXT);

        assertTrue(pipeline.parse(null, "<start_function_call>call:add{}<end_function_call>").isEmpty());
        assertTrue(pipeline.parse(artifact, "  ").isEmpty());
    }

    @Test
    void shouldResolveStrategyFromValue() {
        assertEquals(GrammarStrategy.TAGGED_TEXT, GrammarStrategy.fromValue("tagged-text"));
        assertEquals(GrammarStrategy.JSON_SCHEMA, GrammarStrategy.fromValue("json-schema"));
        assertThrows(IllegalArgumentException.class, () -> GrammarStrategy.fromValue("regex"));
    }
}
