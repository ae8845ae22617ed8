package me.golemcore.agentkernel.domain.grammar;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.exception.GrammarSchemaException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural-tag constraint: one structure per tool that opens with
 * {@code <function=NAME>}, carries a body matching the tool's parameter
 * schema and closes with {@code </function>}. Constrained decoding switches
 * on when the model emits the trigger prefix.
 */
public class StructuralGrammar extends AbstractGrammarCodec {

    public static final String TRIGGER = "<function=";
    public static final String BEGIN_SUFFIX = ">";
    public static final String END = "</function>";

    private static final Set<String> UNION_KEYWORDS = Set.of("anyOf", "oneOf", "allOf");

    public StructuralGrammar(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public GrammarStrategy strategy() {
        return GrammarStrategy.STRUCTURAL;
    }

    @Override
    public GrammarArtifact build(List<ToolSchema> tools) {
        List<Map<String, Object>> structures = new ArrayList<>();
        for (ToolSchema tool : tools) {
            rejectUnions(tool.getName(), tool.getParameters(), "parameters");
            Map<String, Object> structure = new LinkedHashMap<>();
            structure.put("begin", beginMarker(tool.getName()));
            structure.put("schema", tool.getParameters());
            structure.put("end", END);
            structures.add(structure);
        }
        Map<String, Object> tag = new LinkedHashMap<>();
        tag.put("type", "structural_tag");
        tag.put("structures", structures);
        tag.put("triggers", List.of(TRIGGER));

        String document = toJson(tag);
        return GrammarArtifact.builder()
                .strategy(strategy())
                .payload(structuredOutputs("structural_tag", "structural_tag", document))
                .document(document)
                .toolNameLiterals(tools.stream().map(ToolSchema::getName).toList())
                .triggers(List.of(TRIGGER))
                .tools(indexTools(tools))
                .build();
    }

    private static String beginMarker(String toolName) {
        return TRIGGER + toolName + BEGIN_SUFFIX;
    }

    private static void rejectUnions(String toolName, Object node, String path) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (UNION_KEYWORDS.contains(key)) {
                    throw new GrammarSchemaException(toolName, "Tool '" + toolName
                            + "' uses '" + key + "' at " + path + ", which the structural strategy cannot express");
                }
                if ("type".equals(key) && entry.getValue() instanceof List) {
                    throw new GrammarSchemaException(toolName, "Tool '" + toolName
                            + "' declares a union type at " + path + ", which the structural strategy cannot express");
                }
                rejectUnions(toolName, entry.getValue(), path + "." + key);
            }
        } else if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                rejectUnions(toolName, list.get(i), path + "[" + i + "]");
            }
        }
    }

    @Override
    public List<ParsedCall> parse(GrammarArtifact artifact, String text) {
        List<String> names = longestFirst(artifact.toolNames());
        List<ParsedCall> calls = new ArrayList<>();
        int cursor = 0;
        while (true) {
            int start = text.indexOf(TRIGGER, cursor);
            if (start < 0) {
                break;
            }
            int pos = start + TRIGGER.length();
            String name = matchKnownName(text, pos, names);
            if (name == null) {
                int close = text.indexOf(BEGIN_SUFFIX, pos);
                if (close < 0) {
                    calls.add(ParsedCall.failed(null, text.substring(start), "unterminated begin marker"));
                    break;
                }
                name = text.substring(pos, close);
            }
            int bodyStart = JsonScanner.skipWhitespace(text, pos + name.length() + BEGIN_SUFFIX.length());
            if (bodyStart >= text.length() || text.charAt(bodyStart) != '{') {
                calls.add(ParsedCall.failed(name, excerpt(text, start), "expected a JSON object after the begin marker"));
                cursor = bodyStart;
                continue;
            }
            int bodyEnd = JsonScanner.findValueEnd(text, bodyStart);
            if (bodyEnd < 0) {
                calls.add(ParsedCall.failed(name, text.substring(start), "unterminated argument object"));
                break;
            }
            int after = JsonScanner.skipWhitespace(text, bodyEnd);
            if (!text.startsWith(END, after)) {
                calls.add(ParsedCall.failed(name, text.substring(start, bodyEnd), "missing end marker"));
                cursor = bodyEnd;
                continue;
            }
            int segmentEnd = after + END.length();
            String raw = text.substring(start, segmentEnd);
            calls.add(validate(artifact.tool(name), decodeCall(name, text.substring(bodyStart, bodyEnd), raw), raw));
            cursor = segmentEnd;
        }
        return calls;
    }

    private static ParsedCall validate(ToolSchema tool, ParsedCall decoded, String raw) {
        if (decoded.isError() || tool == null) {
            return decoded;
        }
        List<String> violations = ArgumentSchemaValidator.validate(tool.getParameters(),
                decoded.call().getArguments());
        if (violations.isEmpty()) {
            return decoded;
        }
        return ParsedCall.failed(tool.getName(), raw, "arguments do not match schema: " + String.join("; ", violations));
    }

    private static String matchKnownName(String text, int pos, List<String> names) {
        for (String name : names) {
            if (text.startsWith(name + BEGIN_SUFFIX, pos)) {
                return name;
            }
        }
        return null;
    }

    private static String excerpt(String text, int start) {
        int end = text.indexOf(END, start);
        return end < 0 ? text.substring(start) : text.substring(start, end + END.length());
    }

    @Override
    public String render(List<Message.ToolCall> calls) {
        StringBuilder sb = new StringBuilder();
        for (Message.ToolCall call : calls) {
            sb.append(beginMarker(call.getName()))
                    .append(toJson(call.getArguments()))
                    .append(END);
        }
        return sb.toString();
    }
}
