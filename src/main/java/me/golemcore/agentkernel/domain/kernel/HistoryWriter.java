package me.golemcore.agentkernel.domain.kernel;

import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolResult;

import java.util.List;

/**
 * Single point of mutation for the raw history of one kernel run.
 */
public interface HistoryWriter {

    void appendAssistant(String content, List<Message.ToolCall> toolCalls);

    void appendToolResult(ToolResult result);

    /**
     * Replaces the history with a trimmed view produced by a history strategy.
     */
    void replaceWith(List<Message> messages);

    /**
     * Returns an immutable snapshot of the history.
     */
    List<Message> messages();
}
