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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.GrammarSchemaException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolSchema;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for grammar-constrained decoding. Selects the codec for a
 * strategy, builds artifacts from the current tool set and routes parsing to
 * the codec that produced the artifact.
 */
@Slf4j
public class GrammarPipeline {

    private final Map<GrammarStrategy, GrammarCodec> codecs = new EnumMap<>(GrammarStrategy.class);

    public GrammarPipeline(List<GrammarCodec> codecs) {
        for (GrammarCodec codec : codecs) {
            this.codecs.put(codec.strategy(), codec);
        }
    }

    /**
     * Pipeline with the tagged-text, structural and json-schema codecs.
     */
    public static GrammarPipeline standard(ObjectMapper objectMapper) {
        return new GrammarPipeline(List.of(
                new TaggedTextGrammar(objectMapper),
                new StructuralGrammar(objectMapper),
                new JsonSchemaGrammar(objectMapper)));
    }

    public boolean supports(GrammarStrategy strategy) {
        return strategy == GrammarStrategy.NONE || codecs.containsKey(strategy);
    }

    /**
     * Builds the artifact for the tools, or returns null when the strategy is
     * {@link GrammarStrategy#NONE} or there are no tools to constrain.
     *
     * @throws GrammarSchemaException
     *             when a schema is not expressible or tool names collide
     */
    public GrammarArtifact build(List<ToolSchema> tools, GrammarStrategy strategy) {
        if (strategy == null || strategy == GrammarStrategy.NONE || tools == null || tools.isEmpty()) {
            return null;
        }
        validateNames(tools);
        GrammarArtifact artifact = codec(strategy).build(tools);
        log.debug("[Grammar] Built {} artifact for {} tools", strategy.getValue(), tools.size());
        return artifact;
    }

    public List<ParsedCall> parse(GrammarArtifact artifact, String text) {
        if (artifact == null || text == null || text.isBlank()) {
            return List.of();
        }
        List<ParsedCall> calls = codec(artifact.getStrategy()).parse(artifact, text);
        long failed = calls.stream().filter(ParsedCall::isError).count();
        if (failed > 0) {
            log.warn("[Grammar] {} of {} {} call(s) failed to parse", failed, calls.size(),
                    artifact.getStrategy().getValue());
        }
        return calls;
    }

    public String render(GrammarStrategy strategy, List<Message.ToolCall> calls) {
        return codec(strategy).render(calls);
    }

    private GrammarCodec codec(GrammarStrategy strategy) {
        GrammarCodec codec = codecs.get(strategy);
        if (codec == null) {
            throw new IllegalArgumentException("No grammar codec registered for strategy: " + strategy.getValue());
        }
        return codec;
    }

    private static void validateNames(List<ToolSchema> tools) {
        Set<String> seen = new HashSet<>();
        for (ToolSchema tool : tools) {
            String name = tool.getName();
            if (name == null || name.isBlank()) {
                throw new GrammarSchemaException(name, "Tool name must not be blank");
            }
            if (!seen.add(name)) {
                throw new GrammarSchemaException(name, "Duplicate tool name: " + name);
            }
        }
    }
}
