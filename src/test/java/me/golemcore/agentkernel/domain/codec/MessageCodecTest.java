package me.golemcore.agentkernel.domain.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.grammar.GrammarArtifact;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.ToolResult;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GrammarPipeline pipeline = GrammarPipeline.standard(objectMapper);
    private final List<ToolSchema> tools = List.of(ToolSchema.simple("add", "Adds two numbers"));

    private MessageCodec codec(ModelFamily family) {
        return MessageCodecFactory.create(family, objectMapper, pipeline);
    }

    private static List<Message> conversationWithToolRound() {
        Message.ToolCall call = new Message.ToolCall("call_1", "add", Map.of("x", 2));
        return List.of(
                Message.system("Be precise."),
                Message.user("add 2"),
                Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(call)).build(),
                ToolResult.success(call, "5", Duration.ZERO).toMessage());
    }

    @Test
    void openAiShouldUseStructuredCallsAndApiToolList() {
        MessageCodec codec = codec(ModelFamily.OPENAI);

        ModelRequest request = codec.format(conversationWithToolRound(), tools, null);

        assertEquals(4, request.getMessages().size());
        assertEquals("system", request.getMessages().get(0).get("role"));
        assertEquals("Be precise.", request.getMessages().get(0).get("content"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> toolCalls = (List<Map<String, Object>>) request.getMessages().get(2)
                .get("tool_calls");
        assertEquals("call_1", toolCalls.get(0).get("id"));
        assertEquals("call_1", request.getMessages().get(3).get("tool_call_id"));
        assertEquals(1, request.getTools().size());
        assertEquals("function", request.getTools().get(0).get("type"));
        assertNull(request.getConstraintPayload());
    }

    @Test
    void openAiShouldMapDeveloperToSystem() {
        ModelRequest request = codec(ModelFamily.OPENAI).format(List.of(Message.developer("rules")), tools, null);

        assertEquals("system", request.getMessages().get(0).get("role"));
    }

    @Test
    void openAiShouldNotSupportTextGrammars() {
        MessageCodec codec = codec(ModelFamily.OPENAI);

        assertTrue(codec.supports(GrammarStrategy.NONE));
        assertTrue(codec.supports(GrammarStrategy.JSON_SCHEMA));
        assertFalse(codec.supports(GrammarStrategy.TAGGED_TEXT));
        assertFalse(codec.supports(GrammarStrategy.STRUCTURAL));
    }

    @Test
    void shouldPreferNativeCallsOverText() {
        ModelResponse response = ModelResponse.builder()
                .content("thinking")
                .nativeToolCalls(List.of(ModelResponse.NativeToolCall.builder()
                        .id("srv_1").name("add").arguments("{\"x\": 1}").build()))
                .build();

        ParsedResponse parsed = codec(ModelFamily.OPENAI).parse(response, null);

        assertEquals("thinking", parsed.content());
        assertEquals(1, parsed.calls().size());
        assertEquals("srv_1", parsed.calls().get(0).call().getId());
        assertEquals(Map.of("x", 1), parsed.calls().get(0).call().getArguments());
    }

    @Test
    void shouldReportUndecodableNativeArgumentsNextToValidCall() {
        ModelResponse response = ModelResponse.builder()
                .nativeToolCalls(List.of(
                        ModelResponse.NativeToolCall.builder().id("srv_1").name("add").arguments("{x:").build(),
                        ModelResponse.NativeToolCall.builder().id("srv_2").name("add")
                                .arguments("{\"x\":1,\"y\":2}").build()))
                .build();

        ParsedResponse parsed = codec(ModelFamily.OPENAI).parse(response, null);

        assertEquals(2, parsed.calls().size());
        assertTrue(parsed.calls().get(0).isError());
        assertEquals("add", parsed.calls().get(0).error().toolName());
        assertFalse(parsed.calls().get(1).isError());
        assertTrue(parsed.hasWellFormedCalls());
    }

    @Test
    void shouldDropCallsWhenNoneIsWellFormed() {
        ModelResponse response = ModelResponse.builder()
                .content("Let me add those.")
                .nativeToolCalls(List.of(ModelResponse.NativeToolCall.builder()
                        .id("srv_1").name("add").arguments("{x:").build()))
                .build();

        ParsedResponse parsed = codec(ModelFamily.OPENAI).parse(response, null);

        assertFalse(parsed.hasCalls());
        assertEquals("Let me add those.", parsed.content());
    }

    @Test
    void shouldKeepRawTextWhenEveryTaggedCallIsMalformed() {
        String raw = "<start_function_call>call:add{x: 2}<end_function_call>";
        MessageCodec qwen = codec(ModelFamily.QWEN);
        GrammarArtifact artifact = pipeline.build(tools, GrammarStrategy.TAGGED_TEXT);

        ParsedResponse parsed = qwen.parse(ModelResponse.builder().content(raw).build(), artifact);

        assertFalse(parsed.hasCalls());
        assertEquals(raw, parsed.content());
    }

    @Test
    void plainTextResponseShouldHaveNoCalls() {
        ParsedResponse parsed = codec(ModelFamily.OPENAI).parse(
                ModelResponse.builder().content("The answer is 5").build(), null);

        assertFalse(parsed.hasCalls());
        assertEquals("The answer is 5", parsed.content());
    }

    @Test
    void qwenShouldParseToolCallBlocksFromText() {
        String content = "Let me compute.\n<tool_call>\n{\"name\": \"add\", \"arguments\": {\"x\": 2}}\n</tool_call>";

        ParsedResponse parsed = codec(ModelFamily.QWEN).parse(ModelResponse.builder().content(content).build(), null);

        assertEquals("Let me compute.", parsed.content());
        assertEquals(1, parsed.calls().size());
        assertEquals("add", parsed.calls().get(0).call().getName());
        assertEquals(Map.of("x", 2), parsed.calls().get(0).call().getArguments());
    }

    @Test
    void qwenShouldRenderHistoryCallsAsBlocksUnderNameConvention() {
        MessageCodec codec = MessageCodecFactory.create(ModelFamily.QWEN, objectMapper, pipeline,
                ToolResultConvention.NAME_RESPONSE, ToolDescriptorMode.INLINE_TEXT);

        ModelRequest request = codec.format(conversationWithToolRound(), tools, null);

        String assistant = String.valueOf(request.getMessages().get(2).get("content"));
        assertTrue(assistant.startsWith("<tool_call>\n{\"name\":\"add\""));
        assertEquals("add", request.getMessages().get(3).get("name"));
        assertNull(request.getTools());
        assertTrue(String.valueOf(request.getMessages().get(0).get("content")).contains("Available tools:"));
    }

    @Test
    void qwenShouldUseGrammarParserWhenArtifactPresent() {
        GrammarArtifact artifact = pipeline.build(tools, GrammarStrategy.STRUCTURAL);

        ParsedResponse parsed = codec(ModelFamily.QWEN).parse(ModelResponse.builder()
                .content("ok <function=add>{\"x\": 3}</function>").build(), artifact);

        assertEquals("ok", parsed.content());
        assertEquals(Map.of("x", 3), parsed.calls().get(0).call().getArguments());
    }

    @Test
    void functionGemmaShouldLeadWithDeveloperDeclarations() {
        MessageCodec codec = codec(ModelFamily.FUNCTION_GEMMA);

        ModelRequest request = codec.format(List.of(Message.user("add 2 and 3")), tools, null);

        assertEquals(2, request.getMessages().size());
        Map<String, Object> instruction = request.getMessages().get(0);
        assertEquals("developer", instruction.get("role"));
        String content = String.valueOf(instruction.get("content"));
        assertTrue(content.startsWith(FunctionGemmaMessageCodec.PREAMBLE));
        assertTrue(content.contains("<start_function_declaration>declaration:add{description:<escape>Adds two numbers"
                + "<escape>"));
        assertTrue(content.endsWith("<end_function_declaration>"));
        assertNull(request.getTools());
    }

    @Test
    void functionGemmaShouldMergeDeclarationsIntoExistingSystemMessage() {
        ModelRequest request = codec(ModelFamily.FUNCTION_GEMMA).format(
                List.of(Message.system("Be brief."), Message.user("hi")), tools, null);

        assertEquals(2, request.getMessages().size());
        assertEquals("developer", request.getMessages().get(0).get("role"));
        String content = String.valueOf(request.getMessages().get(0).get("content"));
        assertTrue(content.startsWith("Be brief.\n\n" + FunctionGemmaMessageCodec.PREAMBLE));
    }

    @Test
    void functionGemmaShouldAnswerToolResultsByName() {
        ModelRequest request = codec(ModelFamily.FUNCTION_GEMMA).format(conversationWithToolRound(), tools, null);

        Map<String, Object> toolMessage = request.getMessages().get(3);
        assertEquals("add", toolMessage.get("name"));
        assertEquals("<start_function_response>response:add{value:<escape>5<escape>}<end_function_response>",
                toolMessage.get("content"));
        assertFalse(toolMessage.containsKey("tool_call_id"));
        assertEquals("<start_function_call>call:add{x:2}<end_function_call>",
                request.getMessages().get(2).get("content"));
    }

    @Test
    void functionGemmaShouldParseEscapedNativeCalls() {
        String content = "<start_function_call>call:get_weather{city:<escape>Paris<escape>,days:2}<end_function_call>";

        ParsedResponse parsed = codec(ModelFamily.FUNCTION_GEMMA).parse(
                ModelResponse.builder().content(content).build(), null);

        assertNull(parsed.content());
        assertEquals("get_weather", parsed.calls().get(0).call().getName());
        assertEquals("Paris", parsed.calls().get(0).call().getArguments().get("city"));
        assertEquals(2L, parsed.calls().get(0).call().getArguments().get("days"));
    }

    @Test
    void functionGemmaShouldRenderHistoryThroughGrammarWhenConstrained() {
        GrammarArtifact artifact = pipeline.build(tools, GrammarStrategy.TAGGED_TEXT);

        ModelRequest request = codec(ModelFamily.FUNCTION_GEMMA).format(conversationWithToolRound(), tools, artifact);

        assertEquals("<start_function_call>call:add{\"x\":2}<end_function_call>",
                request.getMessages().get(2).get("content"));
        assertEquals(artifact.getPayload(), request.getConstraintPayload());
    }
}
