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

import me.golemcore.agentkernel.domain.grammar.GrammarArtifact;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.List;
import java.util.Set;

/**
 * Translates between kernel messages and the wire conventions of one model
 * family.
 */
public interface MessageCodec {

    ModelFamily family();

    Set<GrammarStrategy> supportedStrategies();

    default boolean supports(GrammarStrategy strategy) {
        return supportedStrategies().contains(strategy);
    }

    ToolResultConvention resultConvention();

    ToolDescriptorMode descriptorMode();

    /**
     * Renders history and tool descriptors into a request and attaches the
     * artifact's constraint payload, if any.
     */
    ModelRequest format(List<Message> history, List<ToolSchema> tools, GrammarArtifact artifact);

    /**
     * Extracts assistant text and calls from a response. Uses the grammar
     * parser paired with the artifact when one was attached, the family's
     * native parser otherwise.
     */
    ParsedResponse parse(ModelResponse response, GrammarArtifact artifact);
}
