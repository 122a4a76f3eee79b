package com.triggerd.events;

import com.triggerd.dto.EventRequest;
import com.triggerd.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEventSourceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private final MemoryEventSink sink = new MemoryEventSink("tests", new MutableClock(NOW));
    private final MemoryEventSource source = new MemoryEventSource(sink);

    @Test
    @DisplayName("sink should stamp events with its source name and the clock")
    void sink_stampsEvents() {
        sink.send("message_created", Map.of("text", "hi"));
        sink.send("message_created", Map.of("text", "yo"), "slack");

        List<EventRequest> events = sink.getEvents();
        assertEquals("tests", events.get(0).getSource());
        assertEquals("slack", events.get(1).getSource());
        assertEquals(NOW, events.get(0).getTimestamp());
    }

    @Test
    @DisplayName("sink should reject an empty event name")
    void sink_rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> sink.send(" ", Map.of()));
        assertTrue(sink.getEvents().isEmpty());
    }

    @Test
    @DisplayName("null data should be sent as an empty object")
    void sink_nullData() {
        sink.send("ping", null);

        assertTrue(sink.getEvents().get(0).getData().isEmpty());
    }

    @Test
    @DisplayName("source should return each sent event exactly once, in order")
    void source_drainsSink() {
        sink.send("a", Map.of());
        sink.send("b", Map.of());

        List<BatchEvent> first = source.getEvents();
        List<BatchEvent> second = source.getEvents();

        assertEquals(List.of("a", "b"), first.stream().map(BatchEvent::getName).collect(Collectors.toList()));
        assertTrue(second.isEmpty());
        assertTrue(sink.getEvents().isEmpty());
    }
}
