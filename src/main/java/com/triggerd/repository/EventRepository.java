package com.triggerd.repository;

import com.triggerd.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/**
 * Database access for Event entities. Filtering is built with Specifications
 * in {@link EventSpecifications} because every filter dimension is optional.
 */
public interface EventRepository extends JpaRepository<Event, Long>,
        JpaSpecificationExecutor<Event> {
}
