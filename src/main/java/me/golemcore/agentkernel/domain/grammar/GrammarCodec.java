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
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.List;

/**
 * Builder and parser pair for one grammar strategy. Anything {@link #render}
 * produces for known tools must be accepted by the built grammar and decoded
 * back by {@link #parse}.
 */
public interface GrammarCodec {

    GrammarStrategy strategy();

    /**
     * Builds the constraint for the given tools.
     *
     * @throws me.golemcore.agentkernel.domain.exception.GrammarSchemaException
     *             when a tool schema cannot be expressed by this strategy
     */
    GrammarArtifact build(List<ToolSchema> tools);

    /**
     * Recovers calls from constrained output. Never throws on bad input;
     * undecodable segments are returned as parse errors.
     */
    List<ParsedCall> parse(GrammarArtifact artifact, String text);

    /**
     * Renders calls in the surface form this strategy constrains output to.
     */
    String render(List<Message.ToolCall> calls);
}
