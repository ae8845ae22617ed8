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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Outcome of one tool call. Every issued call yields exactly one result, even
 * when the tool is unknown, fails, times out or the run is cancelled.
 */
@Value
@Builder
public class ToolResult {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    String callId;
    String toolName;
    Object output;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    boolean error;
    ToolFailureKind failureKind;
    Duration duration;

    public static ToolResult success(Message.ToolCall call, Object output, Duration duration) {
        return ToolResult.builder()
                .callId(call.getId())
                .toolName(call.getName())
                .output(output)
                .error(false)
                .duration(duration)
                .build();
    }

    public static ToolResult failure(Message.ToolCall call, ToolFailureKind kind, String message,
            Duration duration) {
        return ToolResult.builder()
                .callId(call.getId())
                .toolName(call.getName())
                .output(message)
                .error(true)
                .failureKind(kind)
                .duration(duration)
                .build();
    }

    public Duration getDuration() {
        return duration != null ? duration : Duration.ZERO;
    }

    /**
     * Renders the output as the text fed back to the model. Structured outputs
     * (maps, collections) are serialized as JSON.
     */
    public String outputAsText() {
        if (output == null) {
            return "";
        }
        if (output instanceof String text) {
            return text;
        }
        if (output instanceof Map<?, ?> || output instanceof Collection<?> || output.getClass().isArray()) {
            try {
                return JSON_MAPPER.writeValueAsString(output);
            } catch (JsonProcessingException e) {
                return String.valueOf(output);
            }
        }
        return String.valueOf(output);
    }

    /**
     * Creates the tool-role message carrying this result.
     */
    public Message toMessage() {
        return Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(callId)
                .toolName(toolName)
                .content(outputAsText())
                .build();
    }
}
