package me.golemcore.agentkernel.domain.kernel;

import lombok.Builder;
import lombok.Value;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;

import java.time.Duration;

/**
 * Immutable settings consumed by {@link AgentKernel}.
 */
@Value
@Builder(toBuilder = true)
public class KernelSettings {

    @Builder.Default
    int maxTurns = 20;
    @Builder.Default
    int toolConcurrencyLimit = 10;
    @Builder.Default
    GrammarStrategy grammarStrategy = GrammarStrategy.NONE;
    GrammarStrategy grammarFallbackStrategy;
    @Builder.Default
    Duration runTimeout = Duration.ofMinutes(10);
    @Builder.Default
    Duration modelCallTimeout = Duration.ofSeconds(120);
    @Builder.Default
    int emptyResponseRetries = 2;
    boolean refreshToolsEachTurn;
    @Builder.Default
    TransportRetryPolicy retryPolicy = TransportRetryPolicy.none();

    String model;
    @Builder.Default
    Integer maxTokens = 4096;
    @Builder.Default
    Double temperature = 0.1;
    @Builder.Default
    String toolChoice = "auto";

    public static KernelSettings defaults() {
        return KernelSettings.builder().build();
    }
}
