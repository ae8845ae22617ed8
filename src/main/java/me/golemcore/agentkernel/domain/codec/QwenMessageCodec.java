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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.grammar.JsonScanner;
import me.golemcore.agentkernel.domain.grammar.ParsedCall;
import me.golemcore.agentkernel.domain.model.Message;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Qwen conventions. Calls come back structured when the server runs a tool
 * parser, otherwise as {@code <tool_call>{"name": ..., "arguments": ...}</tool_call>}
 * blocks in the text.
 */
public class QwenMessageCodec extends AbstractMessageCodec {

    static final String TOOL_CALL_START = "<tool_call>";
    static final String TOOL_CALL_END = "</tool_call>";

    public QwenMessageCodec(ObjectMapper objectMapper, GrammarPipeline grammarPipeline,
            ToolResultConvention resultConvention, ToolDescriptorMode descriptorMode) {
        super(objectMapper, grammarPipeline,
                resultConvention != null ? resultConvention : ToolResultConvention.CALL_ID,
                descriptorMode != null ? descriptorMode : ToolDescriptorMode.API_LIST);
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.QWEN;
    }

    @Override
    public Set<GrammarStrategy> supportedStrategies() {
        return EnumSet.allOf(GrammarStrategy.class);
    }

    @Override
    protected String mapRole(String role) {
        return Message.ROLE_DEVELOPER.equals(role) ? Message.ROLE_SYSTEM : role;
    }

    @Override
    protected String nativeCallMarker() {
        return TOOL_CALL_START;
    }

    @Override
    protected String renderNativeCalls(List<Message.ToolCall> calls) {
        StringBuilder sb = new StringBuilder();
        for (Message.ToolCall call : calls) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("name", call.getName());
            block.put("arguments", call.getArguments());
            sb.append(TOOL_CALL_START).append('\n')
                    .append(toJson(block))
                    .append('\n').append(TOOL_CALL_END);
        }
        return sb.toString();
    }

    @Override
    protected List<ParsedCall> parseNativeText(String content) {
        List<ParsedCall> calls = new ArrayList<>();
        int cursor = 0;
        while (true) {
            int start = content.indexOf(TOOL_CALL_START, cursor);
            if (start < 0) {
                break;
            }
            int bodyStart = JsonScanner.skipWhitespace(content, start + TOOL_CALL_START.length());
            int bodyEnd = JsonScanner.findValueEnd(content, bodyStart);
            if (bodyEnd < 0) {
                calls.add(ParsedCall.failed(null, content.substring(start), "unterminated tool_call block"));
                break;
            }
            int after = JsonScanner.skipWhitespace(content, bodyEnd);
            String raw = content.substring(start, Math.min(content.length(), after + TOOL_CALL_END.length()));
            if (!content.startsWith(TOOL_CALL_END, after)) {
                calls.add(ParsedCall.failed(null, raw, "missing " + TOOL_CALL_END));
                cursor = bodyEnd;
                continue;
            }
            calls.add(decodeBlock(content.substring(bodyStart, bodyEnd), raw));
            cursor = after + TOOL_CALL_END.length();
        }
        return calls;
    }

    private ParsedCall decodeBlock(String body, String raw) {
        try {
            Map<String, Object> block = decodeObject(body);
            Object name = block.get("name");
            if (!(name instanceof String toolName) || toolName.isBlank()) {
                return ParsedCall.failed(null, raw, "tool_call block has no name");
            }
            Object arguments = block.get("arguments");
            if (arguments == null) {
                return ParsedCall.of(Message.ToolCall.create(toolName, Map.of()));
            }
            if (arguments instanceof String json) {
                return ParsedCall.of(Message.ToolCall.create(toolName, decodeObject(json)));
            }
            if (arguments instanceof Map<?, ?>) {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = (Map<String, Object>) arguments;
                return ParsedCall.of(Message.ToolCall.create(toolName, map));
            }
            return ParsedCall.failed(toolName, raw, "arguments must be a JSON object");
        } catch (JsonProcessingException e) {
            return ParsedCall.failed(null, raw, "invalid JSON in tool_call block: " + e.getOriginalMessage());
        }
    }
}
