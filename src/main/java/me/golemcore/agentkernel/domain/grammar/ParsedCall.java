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

import me.golemcore.agentkernel.domain.model.Message;

/**
 * One entry recovered from model output: either a decoded call or a parse
 * error, kept in the order they appeared.
 */
public record ParsedCall(Message.ToolCall call, ToolCallParseError error) {

    public static ParsedCall of(Message.ToolCall call) {
        return new ParsedCall(call, null);
    }

    public static ParsedCall failed(String toolName, String rawText, String reason) {
        return new ParsedCall(null, new ToolCallParseError(toolName, rawText, reason));
    }

    public boolean isError() {
        return error != null;
    }
}
