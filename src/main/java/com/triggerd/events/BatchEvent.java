package com.triggerd.events;

import com.triggerd.dto.EventRequest;
import com.triggerd.model.Event;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event as a trigger script receives it on stdin.
 *
 * id is the events-table id. It is null only for events that never went
 * through the daemon, e.g. ones handed from a MemoryEventSink to a
 * MemoryEventSource in tests.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BatchEvent {

    @NotNull(message = "id is required")
    private Long id;

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "data is required")
    private Map<String, Object> data;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    private String source;

    public static BatchEvent from(Event event) {
        return BatchEvent.builder()
                .id(event.getId())
                .name(event.getName())
                .data(event.getData() != null ? event.getData() : new LinkedHashMap<>())
                .timestamp(event.getTimestamp())
                .source(event.getSource())
                .build();
    }

    public static BatchEvent from(EventRequest event) {
        return BatchEvent.builder()
                .name(event.getName())
                .data(event.getData())
                .timestamp(event.getTimestamp())
                .source(event.getSource())
                .build();
    }
}
