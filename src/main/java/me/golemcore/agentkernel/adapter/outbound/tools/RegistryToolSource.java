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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.ToolExecutionException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import me.golemcore.agentkernel.port.outbound.ToolSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-safe in-memory tool registry. Tools are listed in registration order;
 * disabled tools are neither listed nor resolvable.
 */
@Slf4j
public class RegistryToolSource implements ToolSource {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public RegistryToolSource() {
    }

    public RegistryToolSource(Collection<? extends Tool> tools) {
        if (tools != null) {
            tools.forEach(this::register);
        }
    }

    public synchronized void register(Tool tool) {
        Tool previous = tools.put(tool.getName(), tool);
        if (previous != null) {
            log.debug("[Tools] Replaced tool registration: {}", tool.getName());
        }
    }

    public synchronized void unregister(Collection<String> toolNames) {
        if (toolNames == null) {
            return;
        }
        for (String name : toolNames) {
            tools.remove(name);
        }
        log.debug("[Tools] Unregistered tools: {}", toolNames);
    }

    public synchronized Optional<Tool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public synchronized List<ToolSchema> listTools() {
        List<ToolSchema> schemas = new ArrayList<>();
        for (Tool tool : tools.values()) {
            if (tool.isEnabled()) {
                schemas.add(tool.getSchema());
            }
        }
        return List.copyOf(schemas);
    }

    @Override
    public synchronized Optional<ToolSchema> resolve(String name) {
        Tool tool = name != null ? tools.get(name) : null;
        if (tool == null || !tool.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(tool.getSchema());
    }

    @Override
    public Object execute(Message.ToolCall call) throws Exception {
        return execute(call, Map.of());
    }

    @Override
    public Object execute(Message.ToolCall call, Map<String, Object> context) throws Exception {
        Tool tool;
        synchronized (this) {
            tool = tools.get(call.getName());
        }
        if (tool == null) {
            throw new ToolExecutionException(call.getName(), "Unknown tool: " + call.getName());
        }
        if (!tool.isEnabled()) {
            throw new ToolExecutionException(call.getName(), "Tool is disabled: " + call.getName());
        }
        log.trace("[Tools] Executing '{}' with {}", call.getName(), call.getArguments());
        return tool.execute(call.getArguments(), context);
    }
}
