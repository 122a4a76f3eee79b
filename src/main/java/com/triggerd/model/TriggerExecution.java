package com.triggerd.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One attempt to run a trigger's script.
 *
 * completedAt == null means the script is still running, or the daemon died
 * before it could record the outcome. exitCode carries the process exit code,
 * or one of the sentinels below.
 */
@Entity
@Table(name = "trigger_executions", indexes = {
    @Index(name = "idx_executions_trigger_id", columnList = "trigger_id"),
    @Index(name = "idx_executions_created_at", columnList = "created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerExecution {

    /** The script ran past the execution timeout and was killed. */
    public static final int EXIT_TIMEOUT = -1;

    /** The script could not be started or the run failed outside the script. */
    public static final int EXIT_FAILED = -2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trigger_id", nullable = false)
    private Long triggerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private String logs = "";

    @Column(name = "exit_code")
    private Integer exitCode;

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isSuccessful() {
        return exitCode != null && exitCode == 0;
    }
}
