package me.golemcore.agentkernel.domain.kernel;

import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory history of one run, seeded with the caller's initial messages.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;
    private final List<Message> history;

    public DefaultHistoryWriter(Clock clock, List<Message> initialMessages) {
        this.clock = clock;
        this.history = new ArrayList<>(initialMessages != null ? initialMessages : List.of());
    }

    @Override
    public void appendAssistant(String content, List<Message.ToolCall> toolCalls) {
        history.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(toolCalls != null && !toolCalls.isEmpty() ? List.copyOf(toolCalls) : null)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(ToolResult result) {
        history.add(result.toMessage().toBuilder()
                .timestamp(now())
                .build());
    }

    @Override
    public void replaceWith(List<Message> messages) {
        history.clear();
        history.addAll(messages);
    }

    @Override
    public List<Message> messages() {
        return List.copyOf(history);
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
