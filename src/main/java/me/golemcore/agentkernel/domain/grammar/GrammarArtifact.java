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

import lombok.Builder;
import lombok.Value;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of a grammar build: the request payload that constrains decoding
 * plus the metadata the paired parser needs to read the constrained output
 * back.
 */
@Value
@Builder
public class GrammarArtifact {

    GrammarStrategy strategy;
    Map<String, Object> payload;
    String document; // EBNF text, structural tag JSON or JSON schema JSON
    List<String> toolNameLiterals; // escaped as they appear in the document
    List<String> triggers;
    Map<String, ToolSchema> tools; // declaration order

    public List<String> toolNames() {
        return new ArrayList<>(tools.keySet());
    }

    public ToolSchema tool(String name) {
        return tools.get(name);
    }
}
