package me.golemcore.agentkernel.adapter.outbound.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.ExceptionMessages;
import me.golemcore.agentkernel.domain.exception.ModelTransportException;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.TokenUsage;
import me.golemcore.agentkernel.port.outbound.ModelClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Model client backed by a langchain4j {@link ChatModel}, for providers whose
 * tool calling is native (OpenAI and compatible hosted APIs).
 *
 * <p>
 * Wire messages produced by the family codec are converted back to langchain4j
 * chat messages, and function descriptors to {@link ToolSpecification}s.
 * langchain4j offers no way to pass a decoding grammar, so a constraint payload
 * on the request is ignored with a single warning.
 */
@Slf4j
public class Langchain4jModelClient implements ModelClient {

    public static final String PROVIDER_ID = "langchain4j";

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String KEY_FUNCTION = "function";

    private final ChatModel chatModel;
    private final Executor executor;
    private final AtomicBoolean constraintWarningLogged = new AtomicBoolean(false);

    public Langchain4jModelClient(ChatModel chatModel) {
        this(chatModel, ModelCallThreadFactory.newExecutor());
    }

    public Langchain4jModelClient(ChatModel chatModel, Executor executor) {
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public CompletableFuture<ModelResponse> complete(ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (request.hasConstraint() && constraintWarningLogged.compareAndSet(false, true)) {
                log.warn("[Model] langchain4j provider cannot apply decoding constraints, payload ignored");
            }
            List<ChatMessage> messages = convertMessages(request.getMessages());
            List<ToolSpecification> tools = convertTools(request.getTools());
            try {
                ChatResponse response;
                if (!tools.isEmpty()) {
                    log.trace("[Model] Calling langchain4j model with {} tools", tools.size());
                    response = chatModel.chat(ChatRequest.builder()
                            .messages(messages)
                            .toolSpecifications(tools)
                            .build());
                } else {
                    response = chatModel.chat(ChatRequest.builder()
                            .messages(messages)
                            .build());
                }
                return convertResponse(response);
            } catch (RuntimeException e) {
                boolean retryable = isRetryableError(e);
                log.warn("[Model] langchain4j chat failed (retryable={}): {}", retryable,
                        ExceptionMessages.safeCauseMessage(e));
                throw new ModelTransportException("Model call failed: " + ExceptionMessages.safeCauseMessage(e), e,
                        retryable);
            }
        }, executor);
    }

    boolean isRetryableError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException
                    || current instanceof TimeoutException
                    || current instanceof java.net.SocketTimeoutException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("503") || msg.contains("timed out"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    List<ChatMessage> convertMessages(List<Map<String, Object>> wireMessages) {
        List<ChatMessage> messages = new ArrayList<>();
        if (wireMessages == null) {
            return messages;
        }
        for (Map<String, Object> wire : wireMessages) {
            String role = String.valueOf(wire.get("role"));
            String content = wire.get("content") != null ? String.valueOf(wire.get("content")) : "";
            switch (role) {
            case "user" -> messages.add(UserMessage.from(content));
            case "assistant" -> {
                List<Map<String, Object>> toolCalls = (List<Map<String, Object>>) wire.get("tool_calls");
                if (toolCalls != null && !toolCalls.isEmpty()) {
                    List<ToolExecutionRequest> requests = toolCalls.stream()
                            .map(this::toExecutionRequest)
                            .toList();
                    messages.add(content.isEmpty() ? AiMessage.from(requests) : AiMessage.from(content, requests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case "tool" -> messages.add(ToolExecutionResultMessage.from(
                    (String) wire.get("tool_call_id"),
                    (String) wire.get("name"),
                    content));
            case "system", "developer" -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("[Model] Unknown message role: {}, treating as user message", role);
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    @SuppressWarnings("unchecked")
    private ToolExecutionRequest toExecutionRequest(Map<String, Object> toolCall) {
        Map<String, Object> function = (Map<String, Object>) toolCall.get(KEY_FUNCTION);
        Object arguments = function != null ? function.get("arguments") : null;
        return ToolExecutionRequest.builder()
                .id((String) toolCall.get("id"))
                .name(function != null ? (String) function.get("name") : null)
                .arguments(arguments != null ? String.valueOf(arguments) : "{}")
                .build();
    }

    @SuppressWarnings("unchecked")
    List<ToolSpecification> convertTools(List<Map<String, Object>> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return Collections.emptyList();
        }
        List<ToolSpecification> specifications = new ArrayList<>();
        for (Map<String, Object> descriptor : descriptors) {
            Map<String, Object> function = (Map<String, Object>) descriptor.get(KEY_FUNCTION);
            if (function != null) {
                specifications.add(convertFunction(function));
            }
        }
        return specifications;
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertFunction(Map<String, Object> function) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name((String) function.get("name"))
                .description((String) function.get("description"));

        Map<String, Object> schema = (Map<String, Object>) function.get("parameters");
        if (schema != null) {
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null && !properties.isEmpty()) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String s ? s : null;
        String description = (String) paramSchema.get("description");
        List<Object> enumValues = (List<Object>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList());
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        if (type == null) {
            type = "string";
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map<?, ?> itemSchema
                    ? toJsonSchemaElement((Map<String, Object>) itemSchema)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // string and anything unknown
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private ModelResponse convertResponse(ChatResponse response) {
        if (response == null || response.aiMessage() == null) {
            return null;
        }
        AiMessage aiMessage = response.aiMessage();

        List<ModelResponse.NativeToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> ModelResponse.NativeToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("[Model] Received {} native tool calls", toolCalls.size());
        }

        TokenUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = TokenUsage.builder()
                    .promptTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .completionTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return ModelResponse.builder()
                .content(aiMessage.text())
                .nativeToolCalls(toolCalls)
                .usage(usage)
                .model(response.modelName())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
