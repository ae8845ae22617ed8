package me.golemcore.agentkernel.domain.kernel;

import me.golemcore.agentkernel.domain.model.TerminationReason;

/**
 * States of a kernel run. Every state except {@link #RUNNING} is terminal.
 */
public enum KernelState {
    RUNNING(null),
    DONE_NO_CALLS(TerminationReason.NO_TOOL_CALLS),
    DONE_MAX_TURNS(TerminationReason.MAX_TURNS),
    DONE_TERMINATION_TOOL(TerminationReason.TERMINATION_TOOL),
    DONE_FATAL(TerminationReason.FATAL_ERROR);

    private final TerminationReason terminationReason;

    KernelState(TerminationReason terminationReason) {
        this.terminationReason = terminationReason;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
