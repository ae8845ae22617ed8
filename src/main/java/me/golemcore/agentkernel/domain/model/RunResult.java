package me.golemcore.agentkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Final outcome of a kernel run. A fatal error is reported here rather than
 * thrown, together with the history accumulated up to that point.
 */
@Value
@Builder
public class RunResult {

    String runId;
    Message finalMessage;
    List<Message> history;
    int turns;
    TerminationReason terminationReason;
    TokenUsage usage;
    Duration duration;
    ToolResult finalToolResult; // set when a termination condition fired
    KernelErrorKind errorKind;
    String error;

    public boolean isSuccessful() {
        return terminationReason != TerminationReason.FATAL_ERROR;
    }
}
