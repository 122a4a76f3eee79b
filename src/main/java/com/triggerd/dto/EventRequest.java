package com.triggerd.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * One event as producers send it to the daemon.
 *
 * Example JSON:
 * {
 *   "name": "message_created",
 *   "source": "slack",
 *   "data": {"channel": "general", "text": "hello"},
 *   "timestamp": "2025-01-01T10:00:00Z"
 * }
 *
 * - name:      matched against Trigger.eventNames
 * - source:    matched against Trigger.eventSources (optional)
 * - data:      arbitrary JSON object handed to trigger scripts untouched
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EventRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String source;

    @NotNull(message = "data is required")
    private Map<String, Object> data;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;
}
