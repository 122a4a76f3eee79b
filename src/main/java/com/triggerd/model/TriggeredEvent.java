package com.triggerd.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Link row: trigger X consumed event Y as part of execution Z.
 *
 * Consumption is per trigger. The same event can be consumed once by every
 * trigger whose filter matches it, and the unique key stops any single trigger
 * from being handed the same event twice.
 */
@Entity
@Table(name = "triggered_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_triggered_events_trigger_event",
                columnNames = {"trigger_id", "event_id"})
    },
    indexes = {
        @Index(name = "idx_triggered_events_trigger_id", columnList = "trigger_id"),
        @Index(name = "idx_triggered_events_event_id", columnList = "event_id")
    })
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggeredEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trigger_id", nullable = false)
    private Long triggerId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "execution_id", nullable = false)
    private Long executionId;
}
