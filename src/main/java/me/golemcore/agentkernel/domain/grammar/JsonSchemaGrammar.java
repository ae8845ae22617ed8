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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-Schema constraint: the output must be a non-empty array whose items
 * match one of the declared tools, each item being
 * {@code {"name": <const>, "arguments": <parameters>}}.
 */
public class JsonSchemaGrammar extends AbstractGrammarCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public JsonSchemaGrammar(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public GrammarStrategy strategy() {
        return GrammarStrategy.JSON_SCHEMA;
    }

    @Override
    public GrammarArtifact build(List<ToolSchema> tools) {
        List<Map<String, Object>> variants = new ArrayList<>();
        for (ToolSchema tool : tools) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("name", Map.of("const", tool.getName()));
            properties.put("arguments", tool.getParameters());

            Map<String, Object> variant = new LinkedHashMap<>();
            variant.put("type", "object");
            variant.put("properties", properties);
            variant.put("required", List.of("name", "arguments"));
            variant.put("additionalProperties", false);
            variants.add(variant);
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "array");
        schema.put("minItems", 1);
        schema.put("items", Map.of("anyOf", variants));

        return GrammarArtifact.builder()
                .strategy(strategy())
                .payload(structuredOutputs("json", "json", Map.of("json_schema", schema)))
                .document(toJson(schema))
                .toolNameLiterals(tools.stream().map(ToolSchema::getName).toList())
                .triggers(List.of())
                .tools(indexTools(tools))
                .build();
    }

    @Override
    public List<ParsedCall> parse(GrammarArtifact artifact, String text) {
        if (text == null) {
            return List.of();
        }
        JsonNode root = readRoot(text.trim());
        if (root == null) {
            // prose without any JSON value is a plain answer
            return List.of();
        }
        List<ParsedCall> calls = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode item : root) {
                calls.add(readItem(item));
            }
        } else {
            calls.add(readItem(root));
        }
        return calls;
    }

    private JsonNode readRoot(String text) {
        JsonNode root = tryRead(text);
        if (root != null && root.isContainerNode()) {
            return root;
        }
        // Recover the first balanced value when the model wrapped it in prose
        int start = JsonScanner.findFirstContainerStart(text);
        if (start < 0) {
            return null;
        }
        int end = JsonScanner.findValueEnd(text, start);
        if (end < 0) {
            return null;
        }
        root = tryRead(text.substring(start, end));
        return root != null && root.isContainerNode() ? root : null;
    }

    private JsonNode tryRead(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ParsedCall readItem(JsonNode item) {
        String raw = item.toString();
        if (!item.isObject()) {
            return ParsedCall.failed(null, raw, "call entry is not an object");
        }
        JsonNode name = item.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            return ParsedCall.failed(null, raw, "call entry has no tool name");
        }
        JsonNode arguments = item.get("arguments");
        if (arguments == null || arguments.isNull()) {
            return ParsedCall.of(Message.ToolCall.create(name.asText(), Map.of()));
        }
        if (arguments.isTextual()) {
            return decodeCall(name.asText(), arguments.asText(), raw);
        }
        if (!arguments.isObject()) {
            return ParsedCall.failed(name.asText(), raw, "arguments must be a JSON object");
        }
        Map<String, Object> decoded = objectMapper.convertValue(arguments, MAP_TYPE);
        return ParsedCall.of(Message.ToolCall.create(name.asText(), decoded));
    }

    @Override
    public String render(List<Message.ToolCall> calls) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", call.getName());
            item.put("arguments", call.getArguments());
            items.add(item);
        }
        return toJson(items);
    }
}
