package com.triggerd.service;

import com.triggerd.dto.TriggerDefinition;
import com.triggerd.dto.TriggerFilter;
import com.triggerd.dto.TriggerUpdate;
import com.triggerd.model.Trigger;
import com.triggerd.repository.OffsetLimitRequest;
import com.triggerd.repository.TriggerRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the triggers table and the next_run_at invariant.
 *
 * FLOW (create):
 *   1. Validate cron, script path and name uniqueness (nothing persisted on failure)
 *   2. Save with created_at = now
 *   3. next_run_at = first cron occurrence after now, if enabled
 *   4. No name given → rename to "trigger-{id}" once the id is known
 *
 * next_run_at is recomputed from "now" on create, on enable and on a cron
 * change of an enabled trigger; disabling clears it. The scheduler advances it
 * through {@link #updateNextRunTime} each time it dispatches a trigger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final TriggerRepository triggerRepository;
    private final CronSchedules cronSchedules;
    private final Clock clock;

    @Transactional
    public Trigger create(String name, String cronSchedule, String scriptPath) {
        return create(TriggerDefinition.builder()
                .name(name)
                .cronSchedule(cronSchedule)
                .scriptPath(scriptPath)
                .build());
    }

    @Transactional
    public Trigger create(TriggerDefinition definition) {
        cronSchedules.validate(definition.getCronSchedule());
        requireScriptPath(definition.getScriptPath());

        String name = definition.getName();
        if (name != null && name.isBlank()) {
            throw new TriggerConfigurationException("Trigger name must not be blank");
        }
        if (name != null && triggerRepository.existsByName(name)) {
            throw new TriggerConfigurationException("Trigger already exists: " + name);
        }

        Instant now = clock.instant();
        Trigger trigger = Trigger.builder()
                // Placeholder keeps the unique NOT NULL column satisfied until the id exists
                .name(name != null ? name : "pending-" + UUID.randomUUID())
                .enabled(definition.isEnabled())
                .cronSchedule(definition.getCronSchedule().trim())
                .scriptPath(definition.getScriptPath())
                .eventNames(copyOrNull(definition.getEventNames()))
                .eventSources(copyOrNull(definition.getEventSources()))
                .createdAt(now)
                .build();
        trigger.setNextRunAt(nextRunFrom(trigger, now));

        Trigger saved = triggerRepository.saveAndFlush(trigger);
        if (name == null) {
            saved.setName("trigger-" + saved.getId());
            saved = triggerRepository.save(saved);
        }

        log.info("Created trigger: id={}, name={}, cron={}, nextRunAt={}",
                saved.getId(), saved.getName(), saved.getCronSchedule(), saved.getNextRunAt());
        return saved;
    }

    /**
     * Applies the non-null fields of {@code update}.
     *
     * @return false when the trigger does not exist or the update is empty
     */
    @Transactional
    public boolean update(Long id, TriggerUpdate update) {
        if (update == null || update.isEmpty()) {
            return false;
        }
        Optional<Trigger> found = triggerRepository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        Trigger trigger = found.get();

        if (update.getCronSchedule() != null) {
            cronSchedules.validate(update.getCronSchedule());
        }
        if (update.getScriptPath() != null) {
            requireScriptPath(update.getScriptPath());
        }

        boolean reschedule = false;
        if (update.getEnabled() != null && update.getEnabled() != trigger.isEnabled()) {
            trigger.setEnabled(update.getEnabled());
            reschedule = true;
        }
        if (update.getCronSchedule() != null
                && !Objects.equals(update.getCronSchedule().trim(), trigger.getCronSchedule())) {
            trigger.setCronSchedule(update.getCronSchedule().trim());
            reschedule = true;
        }
        if (update.getScriptPath() != null) {
            trigger.setScriptPath(update.getScriptPath());
        }
        if (update.getEventNames() != null) {
            trigger.setEventNames(copyOrNull(update.getEventNames()));
        }
        if (update.getEventSources() != null) {
            trigger.setEventSources(copyOrNull(update.getEventSources()));
        }
        if (reschedule) {
            trigger.setNextRunAt(nextRunFrom(trigger, clock.instant()));
        }

        triggerRepository.save(trigger);
        log.info("Updated trigger: id={}, enabled={}, cron={}, nextRunAt={}",
                id, trigger.isEnabled(), trigger.getCronSchedule(), trigger.getNextRunAt());
        return true;
    }

    @Transactional
    public boolean setEnabled(String name, boolean enabled) {
        Trigger trigger = requireByName(name);
        return update(trigger.getId(), TriggerUpdate.builder().enabled(enabled).build());
    }

    @Transactional(readOnly = true)
    public Optional<Trigger> get(Long id) {
        return triggerRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<Trigger> getByName(String name) {
        return triggerRepository.findByName(name);
    }

    @Transactional(readOnly = true)
    public Trigger requireByName(String name) {
        return triggerRepository.findByName(name)
                .orElseThrow(() -> new EntityNotFoundException("Trigger not found: " + name));
    }

    @Transactional(readOnly = true)
    public List<Trigger> getAll(TriggerFilter filter) {
        Specification<Trigger> spec = Specification.allOf(
                enabledIs(filter.getEnabled()),
                hasSchedule(filter.getHasSchedule()));
        Pageable page = OffsetLimitRequest.of(filter.getLimit(), filter.getOffset(), NEWEST_FIRST);
        return page.isPaged()
                ? triggerRepository.findAll(spec, page).getContent()
                : triggerRepository.findAll(spec, NEWEST_FIRST);
    }

    @Transactional
    public boolean delete(Long id) {
        if (!triggerRepository.existsById(id)) {
            return false;
        }
        triggerRepository.deleteById(id);
        log.info("Deleted trigger: id={}", id);
        return true;
    }

    @Transactional
    public boolean deleteByName(String name) {
        boolean deleted = triggerRepository.deleteByName(name) > 0;
        if (deleted) {
            log.info("Deleted trigger: name={}", name);
        }
        return deleted;
    }

    /**
     * Removes every trigger. Executions, events and consumption links stay.
     */
    @Transactional
    public long deleteAll() {
        long count = triggerRepository.count();
        triggerRepository.deleteAllInBatch();
        log.info("Deleted all triggers: count={}", count);
        return count;
    }

    /**
     * Triggers with enabled = true and next_run_at <= now, in id order.
     */
    @Transactional(readOnly = true)
    public List<Trigger> getDueTriggers(Instant now) {
        return triggerRepository.findByEnabledTrueAndNextRunAtLessThanEqualOrderByIdAsc(now);
    }

    @Transactional
    public void updateNextRunTime(Long id) {
        updateNextRunTime(id, clock.instant());
    }

    /**
     * Advances next_run_at to the first cron occurrence strictly after
     * {@code from}. Disabled or missing triggers are left alone.
     */
    @Transactional
    public void updateNextRunTime(Long id, Instant from) {
        triggerRepository.findById(id)
                .filter(Trigger::isEnabled)
                .filter(t -> t.getCronSchedule() != null)
                .ifPresent(trigger -> {
                    trigger.setNextRunAt(cronSchedules.nextAfter(trigger.getCronSchedule(), from));
                    triggerRepository.save(trigger);
                    log.debug("Rescheduled trigger: id={}, nextRunAt={}", id, trigger.getNextRunAt());
                });
    }

    public boolean validateCronSchedule(String cronSchedule) {
        return cronSchedules.isValid(cronSchedule);
    }

    // --- Helpers ---

    private Instant nextRunFrom(Trigger trigger, Instant from) {
        if (!trigger.isEnabled() || trigger.getCronSchedule() == null) {
            return null;
        }
        return cronSchedules.nextAfter(trigger.getCronSchedule(), from);
    }

    private static void requireScriptPath(String scriptPath) {
        if (scriptPath == null || scriptPath.isBlank()) {
            throw new TriggerConfigurationException("Script path must not be empty");
        }
    }

    private static Set<String> copyOrNull(Set<String> values) {
        return values == null || values.isEmpty() ? null : new LinkedHashSet<>(values);
    }

    private static Specification<Trigger> enabledIs(Boolean enabled) {
        return (root, query, cb) -> enabled == null
                ? cb.conjunction()
                : cb.equal(root.get("enabled"), enabled);
    }

    private static Specification<Trigger> hasSchedule(Boolean hasSchedule) {
        if (hasSchedule == null) {
            return (root, query, cb) -> cb.conjunction();
        }
        return (root, query, cb) -> hasSchedule
                ? cb.isNotNull(root.get("cronSchedule"))
                : cb.isNull(root.get("cronSchedule"));
    }
}
