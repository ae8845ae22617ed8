package me.golemcore.agentkernel.domain.codec;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.grammar.GrammarArtifact;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.grammar.ParsedCall;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Common request rendering and response parsing. Families customise role
 * mapping, the synthetic instruction, inline tool declarations and the
 * native call format through the protected hooks.
 */
@Slf4j
public abstract class AbstractMessageCodec implements MessageCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final ObjectMapper objectMapper;
    protected final GrammarPipeline grammarPipeline;
    private final ToolResultConvention resultConvention;
    private final ToolDescriptorMode descriptorMode;

    protected AbstractMessageCodec(ObjectMapper objectMapper, GrammarPipeline grammarPipeline,
            ToolResultConvention resultConvention, ToolDescriptorMode descriptorMode) {
        this.objectMapper = objectMapper;
        this.grammarPipeline = grammarPipeline;
        this.resultConvention = resultConvention;
        this.descriptorMode = descriptorMode;
    }

    @Override
    public ToolResultConvention resultConvention() {
        return resultConvention;
    }

    @Override
    public ToolDescriptorMode descriptorMode() {
        return descriptorMode;
    }

    @Override
    public ModelRequest format(List<Message> history, List<ToolSchema> tools, GrammarArtifact artifact) {
        List<ToolSchema> toolList = tools != null ? tools : List.of();
        String instruction = buildInstruction(toolList);

        List<Map<String, Object>> wire = new ArrayList<>();
        boolean leadingInstruction = !history.isEmpty() && history.get(0).isInstructionMessage();
        if (!leadingInstruction && instruction != null) {
            wire.add(wireMessage(instructionRole(), instruction));
        }
        for (int i = 0; i < history.size(); i++) {
            Map<String, Object> message = formatMessage(history.get(i), artifact);
            if (i == 0 && leadingInstruction && instruction != null) {
                message.put("content", joinText(String.valueOf(message.get("content")), instruction));
            }
            wire.add(message);
        }

        List<Map<String, Object>> descriptors = null;
        if (descriptorMode == ToolDescriptorMode.API_LIST && !toolList.isEmpty()) {
            descriptors = toolList.stream().map(ToolSchema::toFunctionDescriptor).toList();
        }
        return ModelRequest.builder()
                .messages(wire)
                .tools(descriptors)
                .constraintPayload(artifact != null ? artifact.getPayload() : null)
                .build();
    }

    @Override
    public ParsedResponse parse(ModelResponse response, GrammarArtifact artifact) {
        String content = response.getContent();
        if (response.hasNativeToolCalls()) {
            List<ParsedCall> nativeCalls = decodeNativeCalls(response.getNativeToolCalls());
            return hasWellFormed(nativeCalls)
                    ? new ParsedResponse(content, nativeCalls)
                    : withoutCalls(content, nativeCalls);
        }
        List<ParsedCall> calls;
        String marker;
        if (artifact != null) {
            calls = grammarPipeline.parse(artifact, content);
            marker = artifact.getTriggers().isEmpty() ? null : artifact.getTriggers().get(0);
        } else {
            calls = content != null ? parseNativeText(content) : List.of();
            marker = nativeCallMarker();
        }
        if (calls.isEmpty()) {
            return new ParsedResponse(content, List.of());
        }
        if (!hasWellFormed(calls)) {
            return withoutCalls(content, calls);
        }
        log.debug("[Codec] {} parsed {} call(s) from text", family(), calls.size());
        return new ParsedResponse(leadingText(content, marker), calls);
    }

    protected Map<String, Object> formatMessage(Message message, GrammarArtifact artifact) {
        String role = mapRole(message.getRole());
        if (message.isAssistantMessage() && message.hasToolCalls()) {
            return resultConvention == ToolResultConvention.CALL_ID
                    ? structuredAssistant(message)
                    : wireMessage(role, joinText(message.getContent(), renderCalls(message.getToolCalls(), artifact)));
        }
        if (message.isToolMessage()) {
            if (resultConvention == ToolResultConvention.CALL_ID) {
                Map<String, Object> wire = wireMessage(role, message.getContent());
                wire.put("tool_call_id", message.getToolCallId());
                return wire;
            }
            Map<String, Object> wire = wireMessage(role, renderToolResponse(message.getToolName(), message.getContent()));
            wire.put("name", message.getToolName());
            return wire;
        }
        return wireMessage(role, message.getContent());
    }

    private Map<String, Object> structuredAssistant(Message message) {
        List<Map<String, Object>> toolCalls = new ArrayList<>();
        for (Message.ToolCall call : message.getToolCalls()) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.getName());
            function.put("arguments", toJson(call.getArguments()));

            Map<String, Object> wire = new LinkedHashMap<>();
            wire.put("id", call.getId());
            wire.put("type", "function");
            wire.put("function", function);
            toolCalls.add(wire);
        }
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("role", Message.ROLE_ASSISTANT);
        wire.put("content", message.getContent());
        wire.put("tool_calls", toolCalls);
        return wire;
    }

    private static boolean hasWellFormed(List<ParsedCall> calls) {
        return calls.stream().anyMatch(call -> !call.isError());
    }

    /**
     * A response without a single well-formed call is a final answer: the
     * malformed fragments are dropped and the raw text is kept.
     */
    private ParsedResponse withoutCalls(String content, List<ParsedCall> malformed) {
        log.warn("[Codec] {} response has no well-formed call, dropping {} malformed fragment(s): {}", family(),
                malformed.size(), malformed.get(0).error().reason());
        return new ParsedResponse(content, List.of());
    }

    private String renderCalls(List<Message.ToolCall> calls, GrammarArtifact artifact) {
        if (artifact != null) {
            return grammarPipeline.render(artifact.getStrategy(), calls);
        }
        return renderNativeCalls(calls);
    }

    private String buildInstruction(List<ToolSchema> tools) {
        String preamble = instructionPreamble(tools);
        String inline = descriptorMode == ToolDescriptorMode.INLINE_TEXT && !tools.isEmpty()
                ? renderInlineTools(tools)
                : null;
        if (preamble == null && inline == null) {
            return null;
        }
        return joinText(preamble, inline);
    }

    private List<ParsedCall> decodeNativeCalls(List<ModelResponse.NativeToolCall> nativeCalls) {
        List<ParsedCall> calls = new ArrayList<>();
        for (ModelResponse.NativeToolCall nativeCall : nativeCalls) {
            String arguments = nativeCall.getArguments();
            try {
                Map<String, Object> decoded = arguments == null || arguments.isBlank()
                        ? Map.of()
                        : objectMapper.readValue(arguments, MAP_TYPE);
                String id = nativeCall.getId() != null ? nativeCall.getId() : Message.ToolCall.newId();
                calls.add(ParsedCall.of(new Message.ToolCall(id, nativeCall.getName(), decoded)));
            } catch (JsonProcessingException e) {
                calls.add(ParsedCall.failed(nativeCall.getName(), arguments,
                        "invalid JSON arguments: " + e.getOriginalMessage()));
            }
        }
        return calls;
    }

    /**
     * Maps a kernel role to the role this family expects on the wire.
     */
    protected abstract String mapRole(String role);

    /**
     * Role of the instruction message the codec inserts when the history has
     * none.
     */
    protected String instructionRole() {
        return Message.ROLE_SYSTEM;
    }

    /**
     * Text the family requires at the top of the instruction message, or null.
     */
    protected String instructionPreamble(List<ToolSchema> tools) {
        return null;
    }

    protected String renderInlineTools(List<ToolSchema> tools) {
        StringBuilder sb = new StringBuilder("Available tools:");
        for (ToolSchema tool : tools) {
            sb.append("\n- ").append(tool.getName());
            if (tool.getDescription() != null && !tool.getDescription().isBlank()) {
                sb.append(": ").append(tool.getDescription());
            }
            sb.append("\n  parameters: ").append(toJson(tool.getParameters()));
        }
        return sb.toString();
    }

    /**
     * Renders assistant calls as text when no grammar artifact dictates the
     * format.
     */
    protected String renderNativeCalls(List<Message.ToolCall> calls) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", call.getName());
            item.put("arguments", call.getArguments());
            items.add(item);
        }
        return toJson(items);
    }

    protected String renderToolResponse(String toolName, String content) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("name", toolName);
        envelope.put("response", content);
        return toJson(envelope);
    }

    /**
     * Parses calls the family writes into plain text when the server does not
     * return structured calls.
     */
    protected List<ParsedCall> parseNativeText(String content) {
        return List.of();
    }

    /**
     * Marker that opens a native text call, used to separate prose from calls.
     */
    protected String nativeCallMarker() {
        return null;
    }

    protected Map<String, Object> wireMessage(String role, String content) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("role", role);
        wire.put("content", content != null ? content : "");
        return wire;
    }

    protected Map<String, Object> decodeObject(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, MAP_TYPE);
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value for " + family() + " request", e);
        }
    }

    private static String leadingText(String content, String marker) {
        if (content == null || marker == null) {
            return null;
        }
        int index = content.indexOf(marker);
        String prefix = index < 0 ? content : content.substring(0, index);
        return prefix.isBlank() ? null : prefix.trim();
    }

    private static String joinText(String first, String second) {
        if (first == null || first.isBlank()) {
            return second;
        }
        if (second == null || second.isBlank()) {
            return first;
        }
        return first + "\n\n" + second;
    }
}
