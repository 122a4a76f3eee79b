package com.triggerd.events;

import com.triggerd.dto.EventRequest;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps events in memory. Pair it with a {@link MemoryEventSource} to test a
 * producer and a consumer without a daemon.
 */
public class MemoryEventSink extends AbstractEventSink {

    public static final String KIND = "memory";

    private final List<EventRequest> events = new ArrayList<>();

    public MemoryEventSink(String sourceName, Clock clock) {
        super(sourceName, clock);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    protected synchronized void doSend(EventRequest event) {
        events.add(event);
    }

    public synchronized List<EventRequest> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Returns everything sent so far and empties the sink.
     */
    public synchronized List<EventRequest> drain() {
        List<EventRequest> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }
}
