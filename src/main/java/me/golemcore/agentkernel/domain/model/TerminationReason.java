package me.golemcore.agentkernel.domain.model;

/**
 * Why a kernel run stopped.
 */
public enum TerminationReason {
    NO_TOOL_CALLS, MAX_TURNS, FATAL_ERROR, TERMINATION_TOOL
}
