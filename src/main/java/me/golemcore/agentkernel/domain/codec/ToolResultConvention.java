package me.golemcore.agentkernel.domain.codec;

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

/**
 * How tool results are correlated with the calls they answer.
 */
public enum ToolResultConvention {

    /**
     * Structured assistant {@code tool_calls} answered by tool messages that
     * carry the call id.
     */
    CALL_ID,

    /**
     * Calls rendered as text in the assistant message, answered by tool
     * messages that carry the tool name and a response envelope.
     */
    NAME_RESPONSE
}
