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

import me.golemcore.agentkernel.domain.grammar.ParsedCall;

import java.util.List;

/**
 * Assistant text plus the ordered calls recovered from one model response.
 * Parse errors are only kept next to at least one well-formed call; a
 * response with no well-formed call carries no calls at all.
 */
public record ParsedResponse(String content, List<ParsedCall> calls) {

    public boolean hasCalls() {
        return calls != null && !calls.isEmpty();
    }

    public boolean hasWellFormedCalls() {
        return calls != null && calls.stream().anyMatch(call -> !call.isError());
    }
}
