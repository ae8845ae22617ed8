package me.golemcore.agentkernel.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of a callable tool: its unique name, a human readable
 * description and a JSON-Schema object for its parameters.
 */
@Value
@Builder
public class ToolSchema {

    String name;
    String description;
    Map<String, Object> parameters; // JSON Schema

    /**
     * Creates a simple tool schema without input parameters.
     */
    public static ToolSchema simple(String name, String description) {
        return ToolSchema.builder()
                .name(name)
                .description(description)
                .parameters(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    public Map<String, Object> getParameters() {
        return parameters != null ? parameters : Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Renders the schema as an OpenAI-style function descriptor.
     */
    public Map<String, Object> toFunctionDescriptor() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description != null ? description : "");
        function.put("parameters", getParameters());

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("type", "function");
        descriptor.put("function", function);
        return descriptor;
    }
}
