package me.golemcore.agentkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a single model turn: the assistant message, the calls it made
 * and one result per call in call order.
 */
@Value
@Builder
public class StepResult {

    Message responseMessage;
    List<Message.ToolCall> toolCalls;
    List<ToolResult> toolResults;
    TokenUsage usage;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
