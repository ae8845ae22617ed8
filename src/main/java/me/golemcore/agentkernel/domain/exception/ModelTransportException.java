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
 * Failure talking to the model server. Retryable failures (timeouts, rate
 * limits, server errors, I/O) may be retried by the kernel's retry policy.
 */
public class ModelTransportException extends KernelException {

    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    public ModelTransportException(String message, boolean retryable) {
        super(KernelErrorKind.TRANSPORT, message);
        this.retryable = retryable;
    }

    public ModelTransportException(String message, Throwable cause, boolean retryable) {
        super(KernelErrorKind.TRANSPORT, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
