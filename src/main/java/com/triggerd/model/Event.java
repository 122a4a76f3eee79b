package com.triggerd.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * An immutable fact pushed in by a producer (chat poller, file watcher, ...).
 *
 * Example:
 *   name      = "message_created"
 *   source    = "slack"
 *   data      = {"channel": "general", "text": "hello"}
 *   timestamp = 2025-01-01T10:00:00Z
 *
 * Events are never updated or deleted by the scheduler. Whether a trigger has
 * already seen an event lives in {@link TriggeredEvent}, not here.
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_name", columnList = "name"),
    @Index(name = "idx_events_timestamp", columnList = "timestamp")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String source;

    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> data;

    @Column(nullable = false)
    private Instant timestamp;
}
