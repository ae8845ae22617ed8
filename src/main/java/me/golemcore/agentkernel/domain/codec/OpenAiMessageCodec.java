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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.model.Message;

import java.util.EnumSet;
import java.util.Set;

/**
 * OpenAI chat-completions conventions: developer instructions are sent as
 * system messages, tools go in the API list and calls come back structured.
 */
public class OpenAiMessageCodec extends AbstractMessageCodec {

    private static final Set<GrammarStrategy> STRATEGIES = EnumSet.of(GrammarStrategy.NONE,
            GrammarStrategy.JSON_SCHEMA);

    public OpenAiMessageCodec(ObjectMapper objectMapper, GrammarPipeline grammarPipeline,
            ToolResultConvention resultConvention, ToolDescriptorMode descriptorMode) {
        super(objectMapper, grammarPipeline,
                resultConvention != null ? resultConvention : ToolResultConvention.CALL_ID,
                descriptorMode != null ? descriptorMode : ToolDescriptorMode.API_LIST);
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.OPENAI;
    }

    @Override
    public Set<GrammarStrategy> supportedStrategies() {
        return STRATEGIES;
    }

    @Override
    protected String mapRole(String role) {
        return Message.ROLE_DEVELOPER.equals(role) ? Message.ROLE_SYSTEM : role;
    }
}
