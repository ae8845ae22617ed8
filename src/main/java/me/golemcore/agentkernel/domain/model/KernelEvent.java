package me.golemcore.agentkernel.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Structured lifecycle event emitted by the kernel to its observers.
 */
@Builder
public record KernelEvent(KernelEventType type, Instant timestamp, String runId, int turn,
        Map<String, Object> payload) {
}
