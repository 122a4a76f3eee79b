package com.triggerd.events;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads whatever was sent to a {@link MemoryEventSink}. Each call drains the
 * sink, so an event is returned once.
 */
public class MemoryEventSource implements EventSource {

    public static final String KIND = "memory";

    private final MemoryEventSink sink;

    public MemoryEventSource(MemoryEventSink sink) {
        this.sink = sink;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public List<BatchEvent> getEvents() {
        return sink.drain().stream().map(BatchEvent::from).collect(Collectors.toList());
    }

    public MemoryEventSink getSink() {
        return sink;
    }
}
