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

import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.Map;

/**
 * An executable tool exposed to the model through its schema.
 */
public interface Tool {

    /**
     * Returns the schema the model sees for this tool.
     */
    ToolSchema getSchema();

    /**
     * Executes the tool. Any exception is reported back to the model as an
     * error result for this call only.
     *
     * @param arguments
     *            decoded call arguments
     * @return the tool output; strings are passed through, other values are
     *         rendered as JSON
     */
    Object execute(Map<String, Object> arguments) throws Exception;

    /**
     * Executes the tool with the context of the current turn. Tools that do
     * not read the context keep the single-argument form.
     */
    default Object execute(Map<String, Object> arguments, Map<String, Object> context) throws Exception {
        return execute(arguments);
    }

    default String getName() {
        return getSchema().getName();
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Adapts a function into a tool.
     */
    static Tool of(ToolSchema schema, ToolFunction function) {
        return new Tool() {
            @Override
            public ToolSchema getSchema() {
                return schema;
            }

            @Override
            public Object execute(Map<String, Object> arguments) throws Exception {
                return function.apply(arguments);
            }
        };
    }

    /**
     * Adapts a context-aware function into a tool.
     */
    static Tool withContext(ToolSchema schema, ContextualToolFunction function) {
        return new Tool() {
            @Override
            public ToolSchema getSchema() {
                return schema;
            }

            @Override
            public Object execute(Map<String, Object> arguments) throws Exception {
                return function.apply(arguments, Map.of());
            }

            @Override
            public Object execute(Map<String, Object> arguments, Map<String, Object> context) throws Exception {
                return function.apply(arguments, context != null ? context : Map.of());
            }
        };
    }

    @FunctionalInterface
    interface ToolFunction {
        Object apply(Map<String, Object> arguments) throws Exception;
    }

    @FunctionalInterface
    interface ContextualToolFunction {
        Object apply(Map<String, Object> arguments, Map<String, Object> context) throws Exception;
    }
}
