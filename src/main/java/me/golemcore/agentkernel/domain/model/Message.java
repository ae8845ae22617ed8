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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single entry of the conversation history owned by one kernel run.
 * Messages are immutable once appended; the history writer is the only
 * component that creates assistant and tool messages during a run.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_DEVELOPER = "developer";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    String role;
    String content;
    List<ToolCall> toolCalls;
    String toolCallId; // For tool result messages
    String toolName; // Tool name for tool result messages
    Instant timestamp;

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message developer(String content) {
        return Message.builder().role(ROLE_DEVELOPER).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls != null ? Collections.unmodifiableList(toolCalls) : List.of();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this is an instruction message, i.e. either system or developer
     * role.
     */
    public boolean isInstructionMessage() {
        return ROLE_SYSTEM.equals(role) || ROLE_DEVELOPER.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A single tool invocation requested by the model.
     */
    @Value
    public static class ToolCall {

        private static final String ID_PREFIX = "call_";

        String id;
        String name;
        Map<String, Object> arguments;

        @Builder
        public ToolCall(String id, String name, Map<String, Object> arguments) {
            this.id = id;
            this.name = name;
            // JSON arguments may carry null values, so Map.copyOf is not usable here
            this.arguments = arguments == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        /**
         * Creates a call with a freshly generated, collision-resistant id.
         */
        public static ToolCall create(String name, Map<String, Object> arguments) {
            return new ToolCall(newId(), name, arguments);
        }

        public static String newId() {
            return ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
        }
    }
}
