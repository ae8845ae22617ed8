package me.golemcore.agentkernel.port.outbound;

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

import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port providing the tools a kernel run may call. Implementations must be
 * safe to call concurrently.
 */
public interface ToolSource {

    /**
     * Returns the schemas of all currently available tools, in a stable order.
     */
    List<ToolSchema> listTools();

    /**
     * Resolves a tool by name; empty when the tool is unknown.
     */
    Optional<ToolSchema> resolve(String name);

    /**
     * Resolves several tools by name, in the given order. Unknown names and
     * duplicates are skipped.
     */
    default List<ToolSchema> resolveAll(Collection<String> names) {
        List<ToolSchema> resolved = new ArrayList<>();
        if (names == null) {
            return resolved;
        }
        for (String name : new LinkedHashSet<>(names)) {
            resolve(name).ifPresent(resolved::add);
        }
        return List.copyOf(resolved);
    }

    /**
     * Executes a call and returns its output. Any exception is reported to the
     * model as an error result.
     */
    Object execute(Message.ToolCall call) throws Exception;

    /**
     * Executes a call with the per-turn context built by the kernel. Sources
     * that have no use for the context ignore it.
     */
    default Object execute(Message.ToolCall call, Map<String, Object> context) throws Exception {
        return execute(call);
    }

    /**
     * Context contributed by this source to every turn, merged over the
     * caller's context.
     */
    default List<ContextProvider> contextProviders() {
        return List.of();
    }
}
