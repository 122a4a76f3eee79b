package com.triggerd.events;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The document written to a trigger script's stdin.
 *
 * Example:
 * {
 *   "schema": "triggerd.event-batch",
 *   "version": 1,
 *   "events": [
 *     {"id": 7, "name": "message_created", "data": {"text": "hi"},
 *      "timestamp": "2025-01-01T10:00:00Z", "source": "slack"}
 *   ]
 * }
 *
 * Readers reject any other schema tag or a version they do not know.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EventBatch {

    public static final String SCHEMA = "triggerd.event-batch";
    public static final int VERSION = 1;

    @NotNull(message = "schema is required")
    private String schema;

    @NotNull(message = "version is required")
    private Integer version;

    @NotNull(message = "events is required")
    @Builder.Default
    private List<@Valid BatchEvent> events = new ArrayList<>();

    public static EventBatch of(List<BatchEvent> events) {
        return new EventBatch(SCHEMA, VERSION, new ArrayList<>(events));
    }
}
