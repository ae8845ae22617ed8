package me.golemcore.agentkernel.domain.kernel;

import lombok.Builder;
import lombok.Value;
import me.golemcore.agentkernel.domain.model.ToolResult;
import me.golemcore.agentkernel.port.outbound.ContextProvider;

import java.util.List;
import java.util.function.Predicate;

/**
 * Per-run overrides of the kernel's configuration. Unset fields fall back to
 * the kernel defaults.
 */
@Value
@Builder
public class RunOptions {

    /**
     * Names of the tools offered in this run, resolved through the tool
     * source. Unknown names are skipped; {@code null} offers every tool.
     */
    List<String> toolNames;
    Integer maxTurns;
    Predicate<ToolResult> terminationCondition;
    ContextProvider contextProvider;
    CancellationToken cancellation;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
