package me.golemcore.agentkernel.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agentkernel.domain.codec.ModelFamily;
import me.golemcore.agentkernel.domain.codec.ToolDescriptorMode;
import me.golemcore.agentkernel.domain.codec.ToolResultConvention;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.kernel.KernelSettings;
import me.golemcore.agentkernel.domain.kernel.TransportRetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the agent kernel.
 *
 * <p>
 * All kernel configuration is organized under the {@code kernel.*} prefix. This
 * class contains nested property classes for the subsystems:
 * <ul>
 * <li>{@link RetryProperties} - transport retry policy for model calls</li>
 * <li>{@link ModelProperties} - model server connection and sampling</li>
 * <li>{@link HttpProperties} - HTTP client timeouts and pooling</li>
 * <li>{@link ObserverProperties} - built-in event observers</li>
 * </ul>
 *
 * <p>
 * Enum-valued properties accept their kebab-case form, e.g.
 * {@code kernel.grammar-strategy=tagged-text}.
 */
@ConfigurationProperties(prefix = "kernel")
@Data
public class KernelProperties {

    private int maxTurns = 20;
    private int toolConcurrencyLimit = 10;
    private GrammarStrategy grammarStrategy = GrammarStrategy.NONE;
    private GrammarStrategy grammarFallbackStrategy;
    private HistoryStrategyType historyStrategy = HistoryStrategyType.SLIDING_WINDOW;
    private int maxHistoryMessages = 50;
    private Duration runTimeout = Duration.ofMinutes(10);
    private Duration modelCallTimeout = Duration.ofSeconds(120);
    private Duration toolTimeout = Duration.ofSeconds(30);
    private int emptyResponseRetries = 2;
    private boolean refreshToolsEachTurn = false;
    private ModelFamily modelFamily = ModelFamily.OPENAI;
    private ToolResultConvention toolResultConvention;
    private ToolDescriptorMode toolDescriptorMode;
    private RetryProperties retry = new RetryProperties();
    private ModelProperties model = new ModelProperties();
    private HttpProperties http = new HttpProperties();
    private ObserverProperties observer = new ObserverProperties();

    /**
     * Converts the bound properties into the immutable settings the kernel
     * consumes.
     */
    public KernelSettings toSettings() {
        return KernelSettings.builder()
                .maxTurns(maxTurns)
                .toolConcurrencyLimit(toolConcurrencyLimit)
                .grammarStrategy(grammarStrategy)
                .grammarFallbackStrategy(grammarFallbackStrategy)
                .runTimeout(runTimeout)
                .modelCallTimeout(modelCallTimeout)
                .emptyResponseRetries(emptyResponseRetries)
                .refreshToolsEachTurn(refreshToolsEachTurn)
                .retryPolicy(retry.toPolicy())
                .model(model.getName())
                .maxTokens(model.getMaxTokens())
                .temperature(model.getTemperature())
                .toolChoice(model.getToolChoice())
                .build();
    }

    public enum HistoryStrategyType {
        SLIDING_WINDOW, KEEP_ALL
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxAttempts = 1;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(60);

        public TransportRetryPolicy toPolicy() {
            return TransportRetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialBackoff(initialBackoff)
                    .multiplier(multiplier)
                    .maxBackoff(maxBackoff)
                    .build();
        }
    }

    // ==================== MODEL ====================

    @Data
    public static class ModelProperties {
        /** {@code openai-compatible} (Feign) or {@code langchain4j}. */
        private String provider = "openai-compatible";
        private String baseUrl;
        private String apiKey;
        private String name;
        private Integer maxTokens = 4096;
        private Double temperature = 0.1;
        private String toolChoice = "auto";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ObserverProperties {
        private boolean logging = true;
    }
}
