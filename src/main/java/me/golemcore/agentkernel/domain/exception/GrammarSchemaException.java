package me.golemcore.agentkernel.domain.exception;

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

import me.golemcore.agentkernel.domain.model.KernelErrorKind;

/**
 * Thrown when a tool schema uses a construct the selected grammar strategy
 * cannot express.
 */
public class GrammarSchemaException extends KernelException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public GrammarSchemaException(String toolName, String message) {
        super(KernelErrorKind.SCHEMA, message);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
