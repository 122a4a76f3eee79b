package com.triggerd.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StdinEventSourceTest {

    private final EventBatchCodec codec = EventBatchCodec.standalone();

    private StdinEventSource sourceOf(String stdin) {
        return new StdinEventSource(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), codec);
    }

    @Test
    @DisplayName("empty stdin should yield no events")
    void emptyStdin() {
        assertTrue(sourceOf("").getEvents().isEmpty());
        assertTrue(sourceOf("  \n").getEvents().isEmpty());
    }

    @Test
    @DisplayName("should read the batch once and return the same events on later calls")
    void readsOnce() {
        StdinEventSource source = sourceOf("""
                {"schema": "triggerd.event-batch", "version": 1,
                 "events": [
                   {"id": 1, "name": "a", "data": {"n": 1}, "timestamp": "2025-01-01T10:00:00Z"},
                   {"id": 2, "name": "b", "data": {}, "timestamp": "2025-01-01T10:00:01Z", "source": "slack"}
                 ]}
                """);

        List<BatchEvent> first = source.getEvents();
        List<BatchEvent> second = source.getEvents();

        assertEquals(2, first.size());
        assertSame(first, second);
        assertEquals("a", first.get(0).getName());
        assertEquals("slack", first.get(1).getSource());
        assertEquals(StdinEventSource.KIND, source.kind());
    }

    @Test
    @DisplayName("an invalid batch should raise InvalidEventBatchException")
    void invalidBatch() {
        StdinEventSource source = sourceOf("[1, 2, 3]");

        assertThrows(InvalidEventBatchException.class, source::getEvents);
    }
}
