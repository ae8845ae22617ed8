package me.golemcore.agentkernel.domain.dispatch;

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
import me.golemcore.agentkernel.domain.model.ToolResult;

/**
 * Callbacks from the dispatcher. Call notifications arrive in issuance order,
 * result notifications in completion order, possibly from worker threads.
 */
public interface DispatchListener {

    DispatchListener NOOP = new DispatchListener() {
    };

    default void onCallIssued(Message.ToolCall call) {
    }

    default void onResultReceived(Message.ToolCall call, ToolResult result) {
    }
}
