package com.triggerd.repository;

import com.triggerd.model.TriggeredEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Database access for the trigger ↔ event consumption links.
 *
 * findByExecutionId(executionId)
 * → SELECT * FROM triggered_events WHERE execution_id = ?
 */
public interface TriggeredEventRepository extends JpaRepository<TriggeredEvent, Long> {

    List<TriggeredEvent> findByExecutionId(Long executionId);
}
