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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.ExceptionMessages;
import me.golemcore.agentkernel.domain.exception.ModelTransportException;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.TokenUsage;
import me.golemcore.agentkernel.infrastructure.http.FeignClientFactory;
import me.golemcore.agentkernel.port.outbound.ModelClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Model client for OpenAI-compatible chat-completion servers (vLLM, SGLang,
 * llama.cpp server and the like) using Feign + OkHttp.
 *
 * <p>
 * Messages and tool descriptors arrive already rendered by the family codec.
 * The grammar constraint payload is merged into the top level of the request
 * body, next to the standard fields.
 *
 * <p>
 * HTTP 429, 5xx and I/O failures are reported as retryable transport errors;
 * other client errors are not retryable.
 *
 * <p>
 * Lazy initialization: the Feign client is created on first use.
 */
@Slf4j
public class OpenAiCompatibleModelClient implements ModelClient {

    public static final String PROVIDER_ID = "openai-compatible";

    private final FeignClientFactory feignClientFactory;
    private final String baseUrl;
    private final String apiKey;
    private final String defaultModel;
    private final Executor executor;

    private ChatCompletionsApi client;
    private volatile boolean initialized = false;

    public OpenAiCompatibleModelClient(FeignClientFactory feignClientFactory, String baseUrl, String apiKey,
            String defaultModel) {
        this(feignClientFactory, baseUrl, apiKey, defaultModel, ModelCallThreadFactory.newExecutor());
    }

    public OpenAiCompatibleModelClient(FeignClientFactory feignClientFactory, String baseUrl, String apiKey,
            String defaultModel, Executor executor) {
        this.feignClientFactory = feignClientFactory;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.defaultModel = defaultModel;
        this.executor = executor;
    }

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ModelTransportException("Model base URL is not configured", false);
        }
        this.client = feignClientFactory.create(ChatCompletionsApi.class, baseUrl);
        initialized = true;
        log.info("[Model] OpenAI-compatible client initialized with URL: {}", baseUrl);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    @Override
    public CompletableFuture<ModelResponse> complete(ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            ChatCompletionRequest apiRequest = buildRequest(request);
            try {
                ChatCompletionResponse apiResponse = client.chatCompletion(apiKey != null ? apiKey : "", apiRequest);
                return convertResponse(apiResponse);
            } catch (RetryableException e) {
                throw new ModelTransportException(
                        "Model server unreachable: " + ExceptionMessages.safeCauseMessage(e), e, true);
            } catch (FeignException e) {
                int status = e.status();
                boolean retryable = status == 429 || status >= 500;
                log.warn("[Model] Chat completion failed with HTTP {}", status);
                throw new ModelTransportException("Model server returned HTTP " + status + ": "
                        + ExceptionMessages.safeCauseMessage(e), e, retryable);
            }
        }, executor);
    }

    ChatCompletionRequest buildRequest(ModelRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : defaultModel);
        apiRequest.setMessages(request.getMessages());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());
        if (request.hasTools()) {
            apiRequest.setTools(request.getTools());
            apiRequest.setToolChoice(request.getToolChoice());
        }
        if (request.hasConstraint()) {
            apiRequest.getExtraBody().putAll(request.getConstraintPayload());
        }
        return apiRequest;
    }

    private ModelResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            log.warn("[Model] Chat completion returned no choices");
            return null;
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage();
        if (message == null) {
            return null;
        }

        List<ModelResponse.NativeToolCall> toolCalls = null;
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            toolCalls = message.getToolCalls().stream()
                    .filter(tc -> tc.getFunction() != null)
                    .map(tc -> ModelResponse.NativeToolCall.builder()
                            .id(tc.getId())
                            .name(tc.getFunction().getName())
                            .arguments(tc.getFunction().getArguments())
                            .build())
                    .toList();
        }

        TokenUsage usage = null;
        if (apiResponse.getUsage() != null) {
            ApiUsage apiUsage = apiResponse.getUsage();
            usage = TokenUsage.builder()
                    .promptTokens(apiUsage.getPromptTokens())
                    .completionTokens(apiUsage.getCompletionTokens())
                    .totalTokens(apiUsage.getTotalTokens())
                    .build();
        }

        return ModelResponse.builder()
                .content(message.getContent())
                .nativeToolCalls(toolCalls)
                .usage(usage)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<Map<String, Object>> messages;
        private List<Map<String, Object>> tools;
        @JsonProperty("tool_choice")
        private String toolChoice;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        @JsonIgnore
        private Map<String, Object> extraBody = new LinkedHashMap<>();

        @JsonAnyGetter
        public Map<String, Object> extraBodyFields() {
            return extraBody;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
