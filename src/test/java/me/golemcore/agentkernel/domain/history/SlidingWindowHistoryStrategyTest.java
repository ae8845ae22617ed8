package me.golemcore.agentkernel.domain.history;

import me.golemcore.agentkernel.domain.exception.KernelConfigurationException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowHistoryStrategyTest {

    private static List<Message> toolRound(String id) {
        Message.ToolCall call = new Message.ToolCall(id, "add", Map.of());
        return List.of(
                Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(call)).build(),
                ToolResult.success(call, "ok", Duration.ZERO).toMessage());
    }

    @Test
    void shouldKeepShortHistoryUntouched() {
        List<Message> history = List.of(Message.system("s"), Message.user("u"));

        assertSame(history, new SlidingWindowHistoryStrategy(5).trim(history));
    }

    @Test
    void shouldKeepInstructionHeadAndMostRecentMessages() {
        List<Message> history = new ArrayList<>();
        history.add(Message.system("rules"));
        for (int i = 0; i < 10; i++) {
            history.add(Message.user("m" + i));
        }

        List<Message> trimmed = new SlidingWindowHistoryStrategy(4).trim(history);

        assertEquals(4, trimmed.size());
        assertEquals("rules", trimmed.get(0).getContent());
        assertEquals(List.of("m7", "m8", "m9"), trimmed.subList(1, 4).stream().map(Message::getContent).toList());
    }

    @Test
    void shouldNotStartWindowWithOrphanToolMessage() {
        List<Message> history = new ArrayList<>();
        history.add(Message.user("start"));
        history.addAll(toolRound("a"));
        history.addAll(toolRound("b"));
        history.add(Message.assistant("done"));

        // a window of 2 would begin with the tool result of call "b"
        List<Message> trimmed = new SlidingWindowHistoryStrategy(2).trim(history);

        assertFalse(trimmed.get(0).isToolMessage());
        assertEquals(1, trimmed.size());
        assertEquals("done", trimmed.get(0).getContent());
    }

    @Test
    void shouldKeepOwningAssistantWhenWindowHoldsOnlyToolResults() {
        Message.ToolCall first = new Message.ToolCall("c1", "add", Map.of());
        Message.ToolCall second = new Message.ToolCall("c2", "add", Map.of());
        Message.ToolCall third = new Message.ToolCall("c3", "add", Map.of());
        List<Message> history = new ArrayList<>();
        history.add(Message.system("rules"));
        history.add(Message.user("add three times"));
        history.add(Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(first, second, third)).build());
        history.add(ToolResult.success(first, "1", Duration.ZERO).toMessage());
        history.add(ToolResult.success(second, "2", Duration.ZERO).toMessage());
        history.add(ToolResult.success(third, "3", Duration.ZERO).toMessage());

        List<Message> trimmed = new SlidingWindowHistoryStrategy(3).trim(history);

        assertEquals(5, trimmed.size());
        assertEquals("rules", trimmed.get(0).getContent());
        assertTrue(trimmed.get(1).hasToolCalls());
        assertEquals(List.of("c1", "c2", "c3"),
                trimmed.subList(2, 5).stream().map(Message::getToolCallId).toList());
    }

    @Test
    void shouldRejectTooSmallWindow() {
        assertThrows(KernelConfigurationException.class, () -> new SlidingWindowHistoryStrategy(1));
    }

    @Test
    void keepAllShouldReturnHistoryAsIs() {
        List<Message> history = List.of(Message.user("a"), Message.assistant("b"));

        assertEquals(history, new KeepAllHistoryStrategy().trim(history));
    }
}
