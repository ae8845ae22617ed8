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

/**
 * Creates the codec for a model family, applying optional overrides of the
 * family's result convention and descriptor placement.
 */
public final class MessageCodecFactory {

    private MessageCodecFactory() {
    }

    public static MessageCodec create(ModelFamily family, ObjectMapper objectMapper, GrammarPipeline pipeline) {
        return create(family, objectMapper, pipeline, null, null);
    }

    public static MessageCodec create(ModelFamily family, ObjectMapper objectMapper, GrammarPipeline pipeline,
            ToolResultConvention resultConvention, ToolDescriptorMode descriptorMode) {
        return switch (family) {
        case OPENAI -> new OpenAiMessageCodec(objectMapper, pipeline, resultConvention, descriptorMode);
        case QWEN -> new QwenMessageCodec(objectMapper, pipeline, resultConvention, descriptorMode);
        case FUNCTION_GEMMA -> new FunctionGemmaMessageCodec(objectMapper, pipeline, resultConvention,
                descriptorMode);
        };
    }
}
