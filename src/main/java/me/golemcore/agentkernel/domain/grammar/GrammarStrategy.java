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

import java.util.Locale;

/**
 * How tool calls are constrained during decoding.
 */
public enum GrammarStrategy {

    /**
     * EBNF grammar over tagged text markers.
     */
    TAGGED_TEXT("tagged-text"),

    /**
     * Structural tags: per-tool begin/end markers around a JSON-Schema body.
     */
    STRUCTURAL("structural"),

    /**
     * A JSON-Schema union describing an array of calls.
     */
    JSON_SCHEMA("json-schema"),

    /**
     * No decoding constraint; tool calls come back in the model's native form.
     */
    NONE("none");

    private final String value;

    GrammarStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a strategy from its configuration value ({@code tagged-text}) or
     * constant name ({@code TAGGED_TEXT}).
     */
    public static GrammarStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (GrammarStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown grammar strategy: " + value);
    }
}
