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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing of the grammar codecs: tool indexing, structured-output
 * payload envelopes and JSON argument decoding.
 */
abstract class AbstractGrammarCodec implements GrammarCodec {

    protected static final String STRUCTURED_OUTPUTS = "structured_outputs";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final ObjectMapper objectMapper;

    protected AbstractGrammarCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected static Map<String, ToolSchema> indexTools(List<ToolSchema> tools) {
        Map<String, ToolSchema> byName = new LinkedHashMap<>();
        for (ToolSchema tool : tools) {
            byName.put(tool.getName(), tool);
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * Wraps a constraint into the {@code structured_outputs} request extension.
     */
    protected static Map<String, Object> structuredOutputs(String type, String key, Object value) {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("type", type);
        inner.put(key, value);
        return Collections.unmodifiableMap(Map.of(STRUCTURED_OUTPUTS, Collections.unmodifiableMap(inner)));
    }

    /**
     * Known names sorted longest first so that a name which is a prefix of
     * another never wins the match.
     */
    protected static List<String> longestFirst(List<String> names) {
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }

    protected ParsedCall decodeCall(String toolName, String body, String rawText) {
        try {
            Map<String, Object> arguments = objectMapper.readValue(body, MAP_TYPE);
            return ParsedCall.of(Message.ToolCall.create(toolName, arguments));
        } catch (JsonProcessingException e) {
            return ParsedCall.failed(toolName, rawText, "invalid JSON arguments: " + e.getOriginalMessage());
        }
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + strategy().getValue() + " document", e);
        }
    }
}
