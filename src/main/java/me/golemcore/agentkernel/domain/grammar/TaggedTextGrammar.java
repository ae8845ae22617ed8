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
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * EBNF grammar that forces one or more tagged calls of the form
 * {@code <start_function_call>call:NAME{json arguments}<end_function_call>}.
 * The tool name alternation only admits declared names; argument bodies are
 * any JSON object.
 */
public class TaggedTextGrammar extends AbstractGrammarCodec {

    public static final String CALL_START = "<start_function_call>";
    public static final String CALL_PREFIX = "call:";
    public static final String CALL_END = "<end_function_call>";

    private static final String JSON_RULES = String.join("\n",
            "member ::= json_string ws \":\" ws json_value",
            "json_value ::= json_object | json_array | json_string | json_number | \"true\" | \"false\" | \"null\"",
            "json_object ::= \"{\" ws (member (ws \",\" ws member)*)? ws \"}\"",
            "json_array ::= \"[\" ws (json_value (ws \",\" ws json_value)*)? ws \"]\"",
            "json_string ::= \"\\\"\" json_char* \"\\\"\"",
            "json_char ::= [^\"\\\\\\x00-\\x1f] | \"\\\\\" json_escape",
            "json_escape ::= [\"\\\\/bfnrt] | \"u\" [0-9a-fA-F] [0-9a-fA-F] [0-9a-fA-F] [0-9a-fA-F]",
            "json_number ::= \"-\"? ([0-9] | [1-9] [0-9]*) (\".\" [0-9]+)? ([eE] [-+]? [0-9]+)?",
            "ws ::= [ \\t\\n]*");

    public TaggedTextGrammar(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public GrammarStrategy strategy() {
        return GrammarStrategy.TAGGED_TEXT;
    }

    @Override
    public GrammarArtifact build(List<ToolSchema> tools) {
        List<String> literals = tools.stream()
                .map(tool -> GrammarEscapes.escapeLiteral(tool.getName()))
                .toList();
        String grammar = buildGrammar(literals);
        return GrammarArtifact.builder()
                .strategy(strategy())
                .payload(structuredOutputs("grammar", "grammar", grammar))
                .document(grammar)
                .toolNameLiterals(literals)
                .triggers(List.of(CALL_START))
                .tools(indexTools(tools))
                .build();
    }

    private static String buildGrammar(List<String> literals) {
        StringBuilder sb = new StringBuilder();
        sb.append("root ::= function_call+\n");
        sb.append("function_call ::= ")
                .append(GrammarEscapes.quote(CALL_START)).append(' ')
                .append(GrammarEscapes.quote(CALL_PREFIX))
                .append(" tool_name \"{\" ws (member (ws \",\" ws member)*)? ws \"}\" ")
                .append(GrammarEscapes.quote(CALL_END)).append('\n');
        sb.append("tool_name ::= ");
        for (int i = 0; i < literals.size(); i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            sb.append('"').append(literals.get(i)).append('"');
        }
        sb.append('\n').append(JSON_RULES).append('\n');
        return sb.toString();
    }

    @Override
    public List<ParsedCall> parse(GrammarArtifact artifact, String text) {
        List<String> names = longestFirst(artifact.getToolNameLiterals().stream()
                .map(GrammarEscapes::unescapeLiteral)
                .toList());
        List<ParsedCall> calls = new ArrayList<>();
        int cursor = 0;
        while (true) {
            int start = text.indexOf(CALL_START, cursor);
            if (start < 0) {
                break;
            }
            int pos = start + CALL_START.length();
            if (!text.startsWith(CALL_PREFIX, pos)) {
                calls.add(ParsedCall.failed(null, excerpt(text, start), "missing '" + CALL_PREFIX + "' prefix"));
                cursor = pos;
                continue;
            }
            pos += CALL_PREFIX.length();

            String name = matchKnownName(text, pos, names);
            int bodyStart;
            if (name != null) {
                bodyStart = pos + name.length();
            } else {
                int brace = text.indexOf('{', pos);
                int end = text.indexOf(CALL_END, pos);
                if (brace < 0 || (end >= 0 && end < brace)) {
                    calls.add(ParsedCall.failed(null, excerpt(text, start), "missing argument object"));
                    cursor = pos;
                    continue;
                }
                name = text.substring(pos, brace).trim();
                bodyStart = brace;
            }

            int bodyEnd = JsonScanner.findValueEnd(text, bodyStart);
            if (bodyEnd < 0) {
                calls.add(ParsedCall.failed(name, text.substring(start), "unterminated argument object"));
                break;
            }
            int after = JsonScanner.skipWhitespace(text, bodyEnd);
            if (!text.startsWith(CALL_END, after)) {
                calls.add(ParsedCall.failed(name, text.substring(start, bodyEnd), "missing end marker"));
                cursor = bodyEnd;
                continue;
            }
            int segmentEnd = after + CALL_END.length();
            calls.add(decodeCall(name, text.substring(bodyStart, bodyEnd), text.substring(start, segmentEnd)));
            cursor = segmentEnd;
        }
        return calls;
    }

    private static String matchKnownName(String text, int pos, List<String> names) {
        for (String name : names) {
            int end = pos + name.length();
            if (text.startsWith(name, pos) && end < text.length() && text.charAt(end) == '{') {
                return name;
            }
        }
        return null;
    }

    private static String excerpt(String text, int start) {
        int end = text.indexOf(CALL_END, start);
        return end < 0 ? text.substring(start) : text.substring(start, end + CALL_END.length());
    }

    @Override
    public String render(List<Message.ToolCall> calls) {
        StringBuilder sb = new StringBuilder();
        for (Message.ToolCall call : calls) {
            sb.append(CALL_START).append(CALL_PREFIX).append(call.getName())
                    .append(toJson(call.getArguments()))
                    .append(CALL_END);
        }
        return sb.toString();
    }
}
