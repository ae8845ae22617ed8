package me.golemcore.agentkernel.domain.observer;

import me.golemcore.agentkernel.domain.model.KernelEvent;
import me.golemcore.agentkernel.domain.model.KernelEventType;
import me.golemcore.agentkernel.port.outbound.KernelObserver;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CompositeKernelObserverTest {

    private static KernelEvent event(KernelEventType type) {
        return KernelEvent.builder()
                .type(type)
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .runId("run-1")
                .turn(1)
                .payload(Map.of())
                .build();
    }

    @Test
    void shouldDeliverToEveryObserverDespiteFailures() {
        KernelObserver failing = mock(KernelObserver.class);
        doThrow(new IllegalStateException("observer bug")).when(failing).onEvent(any());
        RecordingKernelObserver recording = new RecordingKernelObserver();
        CompositeKernelObserver composite = new CompositeKernelObserver(List.of(failing, recording));

        composite.onEvent(event(KernelEventType.RUN_STARTED));
        composite.onEvent(event(KernelEventType.RUN_ENDED));

        verify(failing, times(2)).onEvent(any());
        assertEquals(List.of(KernelEventType.RUN_STARTED, KernelEventType.RUN_ENDED), recording.getEventTypes());
    }

    @Test
    void shouldSupportAddingAndRemovingObservers() {
        RecordingKernelObserver recording = new RecordingKernelObserver();
        CompositeKernelObserver composite = new CompositeKernelObserver(List.of());

        composite.add(recording);
        composite.onEvent(event(KernelEventType.ERROR));
        composite.remove(recording);
        composite.onEvent(event(KernelEventType.ERROR));

        assertEquals(1, recording.getEvents().size());
        assertTrue(composite.getObservers().isEmpty());
    }

    @Test
    void recordingObserverShouldFilterByType() {
        RecordingKernelObserver recording = new RecordingKernelObserver();
        recording.onEvent(event(KernelEventType.TOOL_CALL_ISSUED));
        recording.onEvent(event(KernelEventType.TOOL_RESULT_RECEIVED));
        recording.onEvent(event(KernelEventType.TOOL_CALL_ISSUED));

        assertEquals(2, recording.getEvents(KernelEventType.TOOL_CALL_ISSUED).size());

        recording.clear();
        assertTrue(recording.getEvents().isEmpty());
    }

    @Test
    void loggingObserverShouldAcceptAnyEvent() {
        LoggingKernelObserver observer = new LoggingKernelObserver();

        assertDoesNotThrow(() -> observer.onEvent(event(KernelEventType.TURN_COMPLETE)));
        NullKernelObserver.INSTANCE.onEvent(event(KernelEventType.TURN_COMPLETE));
    }
}
