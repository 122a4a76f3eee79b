package com.triggerd.repository;

import com.triggerd.model.Trigger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database access for Trigger entities.
 *
 * findByEnabledTrueAndNextRunAtLessThanEqualOrderByIdAsc(now)
 * → SELECT * FROM triggers WHERE enabled = true AND next_run_at <= ? ORDER BY id
 */
public interface TriggerRepository extends JpaRepository<Trigger, Long>,
        JpaSpecificationExecutor<Trigger> {

    Optional<Trigger> findByName(String name);

    boolean existsByName(String name);

    // Used by the scheduler on every tick
    List<Trigger> findByEnabledTrueAndNextRunAtLessThanEqualOrderByIdAsc(Instant now);

    long deleteByName(String name);
}
