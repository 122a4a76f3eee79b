package com.triggerd.repository;

import com.triggerd.model.TriggerExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface TriggerExecutionRepository extends JpaRepository<TriggerExecution, Long>,
        JpaSpecificationExecutor<TriggerExecution> {
}
