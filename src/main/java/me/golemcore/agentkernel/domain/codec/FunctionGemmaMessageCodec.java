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
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.golemcore.agentkernel.domain.grammar.TaggedTextGrammar.CALL_END;
import static me.golemcore.agentkernel.domain.grammar.TaggedTextGrammar.CALL_PREFIX;
import static me.golemcore.agentkernel.domain.grammar.TaggedTextGrammar.CALL_START;

/**
 * FunctionGemma conventions. The model only calls functions when a developer
 * message declares them, so the codec always leads with one; system messages
 * are sent as developer messages and tool results are answered by name.
 */
public class FunctionGemmaMessageCodec extends AbstractMessageCodec {

    static final String PREAMBLE = "You are a model that can do function calling with the following functions";
    static final String DECLARATION_START = "<start_function_declaration>";
    static final String DECLARATION_END = "<end_function_declaration>";
    static final String RESPONSE_START = "<start_function_response>";
    static final String RESPONSE_END = "<end_function_response>";

    public FunctionGemmaMessageCodec(ObjectMapper objectMapper, GrammarPipeline grammarPipeline,
            ToolResultConvention resultConvention, ToolDescriptorMode descriptorMode) {
        super(objectMapper, grammarPipeline,
                resultConvention != null ? resultConvention : ToolResultConvention.NAME_RESPONSE,
                descriptorMode != null ? descriptorMode : ToolDescriptorMode.INLINE_TEXT);
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.FUNCTION_GEMMA;
    }

    @Override
    public Set<GrammarStrategy> supportedStrategies() {
        return EnumSet.allOf(GrammarStrategy.class);
    }

    @Override
    protected String mapRole(String role) {
        return Message.ROLE_SYSTEM.equals(role) ? Message.ROLE_DEVELOPER : role;
    }

    @Override
    protected String instructionRole() {
        return Message.ROLE_DEVELOPER;
    }

    @Override
    protected String instructionPreamble(List<ToolSchema> tools) {
        return PREAMBLE;
    }

    @Override
    protected String renderInlineTools(List<ToolSchema> tools) {
        StringBuilder sb = new StringBuilder();
        for (ToolSchema tool : tools) {
            Map<String, Object> declaration = new LinkedHashMap<>();
            declaration.put("description", tool.getDescription() != null ? tool.getDescription() : "");
            declaration.put("parameters", tool.getParameters());
            sb.append(DECLARATION_START).append("declaration:").append(tool.getName())
                    .append(EscapedArgumentsParser.render(declaration))
                    .append(DECLARATION_END);
        }
        return sb.toString();
    }

    @Override
    protected String nativeCallMarker() {
        return CALL_START;
    }

    @Override
    protected String renderNativeCalls(List<Message.ToolCall> calls) {
        StringBuilder sb = new StringBuilder();
        for (Message.ToolCall call : calls) {
            sb.append(CALL_START).append(CALL_PREFIX).append(call.getName())
                    .append(EscapedArgumentsParser.render(call.getArguments()))
                    .append(CALL_END);
        }
        return sb.toString();
    }

    @Override
    protected String renderToolResponse(String toolName, String content) {
        Object body = Map.of("value", content != null ? content : "");
        if (content != null && content.trim().startsWith("{")) {
            try {
                body = decodeObject(content);
            } catch (JsonProcessingException e) {
                // not a JSON object, keep it as a plain value
                body = Map.of("value", content);
            }
        }
        return RESPONSE_START + "response:" + toolName + EscapedArgumentsParser.render(body) + RESPONSE_END;
    }

    @Override
    protected List<ParsedCall> parseNativeText(String content) {
        List<ParsedCall> calls = new ArrayList<>();
        int cursor = 0;
        while (true) {
            int start = content.indexOf(CALL_START, cursor);
            if (start < 0) {
                break;
            }
            int pos = start + CALL_START.length();
            if (!content.startsWith(CALL_PREFIX, pos)) {
                calls.add(ParsedCall.failed(null, excerpt(content, start), "missing '" + CALL_PREFIX + "' prefix"));
                cursor = pos;
                continue;
            }
            pos += CALL_PREFIX.length();
            int brace = content.indexOf('{', pos);
            int end = content.indexOf(CALL_END, pos);
            if (brace < 0 || (end >= 0 && end < brace)) {
                calls.add(ParsedCall.failed(null, excerpt(content, start), "missing argument object"));
                cursor = pos;
                continue;
            }
            String name = content.substring(pos, brace).trim();
            EscapedArgumentsParser parser = new EscapedArgumentsParser(content, brace, objectMapper);
            try {
                Map<String, Object> arguments = parser.readObject();
                int after = JsonScanner.skipWhitespace(content, parser.position());
                if (!content.startsWith(CALL_END, after)) {
                    calls.add(ParsedCall.failed(name, excerpt(content, start), "missing end marker"));
                    cursor = parser.position();
                    continue;
                }
                calls.add(ParsedCall.of(Message.ToolCall.create(name, arguments)));
                cursor = after + CALL_END.length();
            } catch (IllegalArgumentException e) {
                calls.add(ParsedCall.failed(name, excerpt(content, start), "malformed arguments: " + e.getMessage()));
                cursor = brace + 1;
            }
        }
        return calls;
    }

    private static String excerpt(String text, int start) {
        int end = text.indexOf(CALL_END, start);
        return end < 0 ? text.substring(start) : text.substring(start, end + CALL_END.length());
    }
}
