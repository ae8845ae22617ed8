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

import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the model server. Implementations must be safe to call from any
 * thread and must honour cancellation of the returned future as far as their
 * transport allows.
 */
public interface ModelClient {

    /**
     * Returns the provider identifier (e.g., "openai-compatible").
     */
    String getProviderId();

    /**
     * Sends one completion request. The future completes exceptionally with a
     * {@link me.golemcore.agentkernel.domain.exception.ModelTransportException}
     * on transport failures.
     */
    CompletableFuture<ModelResponse> complete(ModelRequest request);

    /**
     * Checks if the client is configured and operational.
     */
    default boolean isAvailable() {
        return true;
    }
}
