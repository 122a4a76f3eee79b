package com.triggerd.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Set;

/**
 * A Trigger is a named recurring job: a cron cadence, an optional event filter
 * and the script to run when it fires.
 *
 * Example:
 *   name          = "summarize-slack"
 *   cronSchedule  = "0 9 * * 1-5"
 *   scriptPath    = "/home/me/scripts/summarize.py"
 *   eventNames    = ["message_created"]
 *   eventSources  = ["slack"]
 *
 * nextRunAt is non-null exactly when the trigger is enabled and has a cron
 * schedule. TriggerStore keeps that true; nothing else writes this column.
 */
@Entity
@Table(name = "triggers", indexes = {
    @Index(name = "idx_triggers_created_at", columnList = "created_at"),
    @Index(name = "idx_triggers_next_run_at", columnList = "next_run_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Trigger {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    // Nullable so event-only triggers can be added later without a migration
    @Column(name = "cron_schedule")
    private String cronSchedule;

    @Column(name = "script_path", nullable = false, columnDefinition = "TEXT")
    private String scriptPath;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "event_names", columnDefinition = "TEXT")
    private Set<String> eventNames;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "event_sources", columnDefinition = "TEXT")
    private Set<String> eventSources;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Event-based triggers additionally need at least one unconsumed matching
     * event before they fire. The cron schedule is then only the poll cadence.
     */
    public boolean isEventBased() {
        return (eventNames != null && !eventNames.isEmpty())
                || (eventSources != null && !eventSources.isEmpty());
    }
}
