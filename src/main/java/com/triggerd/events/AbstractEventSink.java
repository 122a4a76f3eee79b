package com.triggerd.events;

import com.triggerd.dto.EventRequest;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stamps every event with the sink's source name (unless overridden) and the
 * current time, then hands it to {@link #doSend}.
 */
public abstract class AbstractEventSink implements EventSink {

    private final String sourceName;
    private final Clock clock;

    protected AbstractEventSink(String sourceName, Clock clock) {
        this.sourceName = sourceName;
        this.clock = clock;
    }

    @Override
    public void send(String name, Map<String, Object> data, String source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name must not be empty");
        }
        doSend(EventRequest.builder()
                .name(name)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .source(source != null ? source : sourceName)
                .timestamp(clock.instant())
                .build());
    }

    protected abstract void doSend(EventRequest event);

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        flush();
    }

    public String getSourceName() {
        return sourceName;
    }
}
