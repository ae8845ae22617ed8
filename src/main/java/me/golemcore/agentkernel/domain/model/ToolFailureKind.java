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

/**
 * Classifies why a tool call produced an error result.
 */
public enum ToolFailureKind {
    /**
     * The requested tool is not known to the tool source.
     */
    UNKNOWN_TOOL,

    /**
     * The model output could not be parsed into a valid call.
     */
    PARSE_FAILED,

    /**
     * The tool raised an error or exceeded its time budget.
     */
    EXECUTION_FAILED,

    /**
     * The run was cancelled before the call completed.
     */
    CANCELLED
}
