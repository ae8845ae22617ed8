package me.golemcore.agentkernel.domain.model;

/**
 * Category of a fatal run error.
 */
public enum KernelErrorKind {
    /**
     * A tool schema cannot be expressed by the selected grammar strategy.
     */
    SCHEMA,

    /**
     * The model server failed or timed out and retries were exhausted.
     */
    TRANSPORT,

    /**
     * The run was cancelled or exceeded its overall deadline.
     */
    CANCELLED,

    /**
     * The model returned no usable response.
     */
    MALFORMED_RESPONSE,

    /**
     * Invalid kernel settings detected at run time.
     */
    CONFIGURATION,

    INTERNAL
}
