package com.triggerd.service;

import com.triggerd.dto.EventFilter;
import com.triggerd.dto.EventRequest;
import com.triggerd.model.Event;
import com.triggerd.model.Trigger;
import com.triggerd.model.TriggeredEvent;
import com.triggerd.repository.EventRepository;
import com.triggerd.repository.EventSpecifications;
import com.triggerd.repository.OffsetLimitRequest;
import com.triggerd.repository.TriggeredEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the events table and the per-trigger consumption links.
 *
 * FLOW (scheduler poll for an event-based trigger):
 *   1. getEventsForTrigger(trigger, false) → matching events with no link row for this trigger
 *   2. Executor creates an execution record
 *   3. markEventsTriggered(trigger, eventIds, execution) → link rows inserted
 *   4. Next poll no longer sees those events for this trigger; other triggers still do
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventStore {

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Order.asc("timestamp"), Sort.Order.asc("id"));

    private final EventRepository eventRepository;
    private final TriggeredEventRepository triggeredEventRepository;
    private final Clock clock;

    @Transactional
    public Event create(String name, String source, Map<String, Object> data, Instant timestamp) {
        Event saved = eventRepository.save(toEntity(name, source, data, timestamp));
        log.debug("Stored event: id={}, name={}, source={}", saved.getId(), name, source);
        return saved;
    }

    /**
     * Stores a batch atomically: either every event is persisted or none.
     */
    @Transactional
    public List<Event> createMany(List<EventRequest> events) {
        List<Event> entities = events.stream()
                .map(e -> toEntity(e.getName(), e.getSource(), e.getData(), e.getTimestamp()))
                .collect(Collectors.toList());
        List<Event> saved = eventRepository.saveAll(entities);
        log.info("Stored events: count={}", saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Event> get(Long id) {
        return eventRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Event> getAll(EventFilter filter) {
        Specification<Event> spec = EventSpecifications.nameIn(filter.getNames())
                .and(EventSpecifications.sourceIn(filter.getSources()));
        return find(spec, filter.getLimit(), filter.getOffset());
    }

    @Transactional(readOnly = true)
    public List<Event> getEventsForTrigger(Trigger trigger, Boolean isConsumed) {
        return getEventsForTrigger(trigger, isConsumed, null, null);
    }

    /**
     * Events matching the trigger's name/source filter, oldest first.
     *
     * @param isConsumed false → not yet consumed by this trigger, true → already
     *                   consumed by it, null → both
     */
    @Transactional(readOnly = true)
    public List<Event> getEventsForTrigger(Trigger trigger, Boolean isConsumed,
                                           Integer limit, Integer offset) {
        Specification<Event> spec = EventSpecifications.matching(trigger);
        if (Boolean.TRUE.equals(isConsumed)) {
            spec = spec.and(EventSpecifications.consumedBy(trigger.getId()));
        } else if (Boolean.FALSE.equals(isConsumed)) {
            spec = spec.and(EventSpecifications.notConsumedBy(trigger.getId()));
        }
        return find(spec, limit, offset);
    }

    /**
     * Records that {@code triggerId} consumed the given events in one execution.
     * A repeat for the same (trigger, event) pair violates the unique key and
     * fails the whole call.
     */
    @Transactional
    public void markEventsTriggered(Long triggerId, Collection<Long> eventIds, Long executionId) {
        if (eventIds.isEmpty()) {
            return;
        }
        List<TriggeredEvent> links = eventIds.stream()
                .map(eventId -> TriggeredEvent.builder()
                        .triggerId(triggerId)
                        .eventId(eventId)
                        .executionId(executionId)
                        .build())
                .collect(Collectors.toList());
        triggeredEventRepository.saveAllAndFlush(links);
        log.debug("Marked events consumed: triggerId={}, executionId={}, count={}",
                triggerId, executionId, links.size());
    }

    @Transactional(readOnly = true)
    public List<TriggeredEvent> getConsumedByExecution(Long executionId) {
        return triggeredEventRepository.findByExecutionId(executionId);
    }

    // --- Helpers ---

    private List<Event> find(Specification<Event> spec, Integer limit, Integer offset) {
        Pageable page = OffsetLimitRequest.of(limit, offset, OLDEST_FIRST);
        return page.isPaged()
                ? eventRepository.findAll(spec, page).getContent()
                : eventRepository.findAll(spec, OLDEST_FIRST);
    }

    private Event toEntity(String name, String source, Map<String, Object> data, Instant timestamp) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name must not be empty");
        }
        return Event.builder()
                .name(name)
                .source(source)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .timestamp(timestamp != null ? timestamp : clock.instant())
                .build();
    }
}
