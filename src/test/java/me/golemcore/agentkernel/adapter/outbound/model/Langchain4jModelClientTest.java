package me.golemcore.agentkernel.adapter.outbound.model;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.agentkernel.domain.exception.ModelTransportException;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class Langchain4jModelClientTest {

    private ChatModel chatModel;
    private Langchain4jModelClient client;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        client = new Langchain4jModelClient(chatModel);
    }

    private static Map<String, Object> addDescriptor() {
        return Map.of("type", "function", "function", Map.of(
                "name", "add",
                "description", "Adds two integers",
                "parameters", Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "x", Map.of("type", "integer"),
                                "values", Map.of("type", "array", "items", Map.of("type", "integer"))),
                        "required", List.of("x"))));
    }

    @Test
    void shouldReturnProviderId() {
        assertEquals("langchain4j", client.getProviderId());
        assertTrue(client.isAvailable());
        assertFalse(new Langchain4jModelClient(null).isAvailable());
    }

    @Test
    void shouldRunCallsOnInjectedExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor(task -> new Thread(task, "test-model-worker"));
        AtomicReference<String> callingThread = new AtomicReference<>();
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            callingThread.set(Thread.currentThread().getName());
            return ChatResponse.builder().aiMessage(AiMessage.from("Hello")).build();
        });
        try {
            ModelResponse response = new Langchain4jModelClient(chatModel, executor).complete(ModelRequest.builder()
                    .messages(List.of(Map.of("role", "user", "content", "hi")))
                    .build()).join();

            assertEquals("Hello", response.getContent());
            assertEquals("test-model-worker", callingThread.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldKeepDefaultCallsOffCommonPool() {
        AtomicReference<String> callingThread = new AtomicReference<>();
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            callingThread.set(Thread.currentThread().getName());
            return ChatResponse.builder().aiMessage(AiMessage.from("Hello")).build();
        });

        client.complete(ModelRequest.builder()
                .messages(List.of(Map.of("role", "user", "content", "hi")))
                .build()).join();

        assertTrue(callingThread.get().startsWith("kernel-model-"), callingThread.get());
    }

    @Test
    void shouldConvertTextResponse() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello"))
                .tokenUsage(new TokenUsage(10, 5))
                .modelName("gpt-4o-mini")
                .finishReason(FinishReason.STOP)
                .build());

        ModelResponse response = client.complete(ModelRequest.builder()
                .messages(List.of(Map.of("role", "user", "content", "hi")))
                .build()).join();

        assertEquals("Hello", response.getContent());
        assertEquals("gpt-4o-mini", response.getModel());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertFalse(response.hasNativeToolCalls());
    }

    @Test
    void shouldPassToolSpecificationsAndMapToolCalls() {
        ToolExecutionRequest request = ToolExecutionRequest.builder()
                .id("call_7").name("add").arguments("{\"x\":1}").build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(request)))
                .build());

        ModelResponse response = client.complete(ModelRequest.builder()
                .messages(List.of(Map.of("role", "user", "content", "add")))
                .tools(List.of(addDescriptor()))
                .build()).join();

        ModelResponse.NativeToolCall call = response.getNativeToolCalls().get(0);
        assertEquals("call_7", call.getId());
        assertEquals("add", call.getName());
        assertEquals("{\"x\":1}", call.getArguments());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ToolSpecification spec = captor.getValue().toolSpecifications().get(0);
        assertEquals("add", spec.name());
        JsonObjectSchema parameters = spec.parameters();
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("x"));
        assertInstanceOf(JsonArraySchema.class, parameters.properties().get("values"));
        assertEquals(List.of("x"), parameters.required());
    }

    @Test
    void shouldConvertWireMessagesByRole() {
        List<Map<String, Object>> wire = List.of(
                Map.of("role", "developer", "content", "be brief"),
                Map.of("role", "user", "content", "add 1"),
                Map.of("role", "assistant", "content", "", "tool_calls", List.of(Map.of(
                        "id", "c1", "type", "function",
                        "function", Map.of("name", "add", "arguments", "{\"x\":1}")))),
                Map.of("role", "tool", "tool_call_id", "c1", "name", "add", "content", "1"));

        List<ChatMessage> messages = client.convertMessages(wire);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage assistant = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("c1", assistant.toolExecutionRequests().get(0).id());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("c1", result.id());
        assertEquals("add", result.toolName());
        assertEquals("1", result.text());
    }

    @Test
    void shouldIgnoreConstraintPayload() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        ModelResponse response = client.complete(ModelRequest.builder()
                .messages(List.of(Map.of("role", "user", "content", "hi")))
                .constraintPayload(Map.of("structured_outputs", Map.of("type", "grammar")))
                .build()).join();

        assertEquals("ok", response.getContent());
    }

    @Test
    void shouldReportRateLimitAsRetryable() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("quota"));

        CompletionException error = assertThrows(CompletionException.class, () -> client.complete(
                ModelRequest.builder().messages(List.of(Map.of("role", "user", "content", "hi"))).build()).join());

        ModelTransportException transport = assertInstanceOf(ModelTransportException.class, error.getCause());
        assertTrue(transport.isRetryable());
    }

    @Test
    void shouldDetectRetryableErrorsInCauseChain() {
        assertTrue(client.isRetryableError(new RuntimeException("wrapped", new SocketTimeoutException("read"))));
        assertTrue(client.isRetryableError(new RuntimeException("HTTP 503 Service Unavailable")));
        assertTrue(client.isRetryableError(new RuntimeException("Too Many Requests")));
        assertFalse(client.isRetryableError(new RuntimeException("invalid api key")));
        assertFalse(client.isRetryableError(new RuntimeException((String) null)));
    }
}
