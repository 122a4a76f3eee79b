package com.triggerd.repository;

import com.triggerd.model.Event;
import com.triggerd.model.Trigger;
import com.triggerd.model.TriggeredEvent;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;

/**
 * Query building blocks for events.
 *
 * Matching rules for a trigger:
 *   - eventNames set   → event.name IN (eventNames)
 *   - eventSources set → event.source IN (eventSources)
 *   - both set         → both must hold
 *   - neither set      → every event matches
 *
 * Consumption is answered from the triggered_events link table and is scoped
 * to one trigger, so the same event can be consumed for A and open for B.
 */
public final class EventSpecifications {

    private EventSpecifications() {
    }

    public static Specification<Event> matching(Trigger trigger) {
        return nameIn(trigger.getEventNames()).and(sourceIn(trigger.getEventSources()));
    }

    public static Specification<Event> nameIn(Collection<String> names) {
        return (root, query, cb) -> names == null || names.isEmpty()
                ? cb.conjunction()
                : root.get("name").in(names);
    }

    public static Specification<Event> sourceIn(Collection<String> sources) {
        return (root, query, cb) -> sources == null || sources.isEmpty()
                ? cb.conjunction()
                : root.get("source").in(sources);
    }

    public static Specification<Event> consumedBy(Long triggerId) {
        return (root, query, cb) -> {
            Subquery<Long> consumed = query.subquery(Long.class);
            Root<TriggeredEvent> link = consumed.from(TriggeredEvent.class);
            consumed.select(link.get("eventId"))
                    .where(cb.equal(link.get("triggerId"), triggerId));
            return root.get("id").in(consumed);
        };
    }

    public static Specification<Event> notConsumedBy(Long triggerId) {
        return Specification.not(consumedBy(triggerId));
    }
}
