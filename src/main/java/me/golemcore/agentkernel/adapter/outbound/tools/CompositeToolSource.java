package me.golemcore.agentkernel.adapter.outbound.tools;

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

import me.golemcore.agentkernel.domain.exception.ToolExecutionException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import me.golemcore.agentkernel.port.outbound.ContextProvider;
import me.golemcore.agentkernel.port.outbound.ToolSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combines several tool sources. The first source that resolves a name owns
 * it; listings are concatenated with later duplicates dropped.
 */
public class CompositeToolSource implements ToolSource {

    private final List<ToolSource> sources;

    public CompositeToolSource(List<ToolSource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public List<ToolSchema> listTools() {
        List<ToolSchema> tools = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ToolSource source : sources) {
            for (ToolSchema tool : source.listTools()) {
                if (seen.add(tool.getName())) {
                    tools.add(tool);
                }
            }
        }
        return List.copyOf(tools);
    }

    @Override
    public Optional<ToolSchema> resolve(String name) {
        for (ToolSource source : sources) {
            Optional<ToolSchema> schema = source.resolve(name);
            if (schema.isPresent()) {
                return schema;
            }
        }
        return Optional.empty();
    }

    @Override
    public Object execute(Message.ToolCall call) throws Exception {
        return execute(call, Map.of());
    }

    @Override
    public Object execute(Message.ToolCall call, Map<String, Object> context) throws Exception {
        for (ToolSource source : sources) {
            if (source.resolve(call.getName()).isPresent()) {
                return source.execute(call, context);
            }
        }
        throw new ToolExecutionException(call.getName(), "Unknown tool: " + call.getName());
    }

    @Override
    public List<ContextProvider> contextProviders() {
        List<ContextProvider> providers = new ArrayList<>();
        for (ToolSource source : sources) {
            providers.addAll(source.contextProviders());
        }
        return List.copyOf(providers);
    }
}
