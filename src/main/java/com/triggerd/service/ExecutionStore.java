package com.triggerd.service;

import com.triggerd.dto.ExecutionFilter;
import com.triggerd.model.TriggerExecution;
import com.triggerd.repository.OffsetLimitRequest;
import com.triggerd.repository.TriggerExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of script runs. Rows are created when a run starts and
 * completed exactly once when it ends; nothing here deletes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final TriggerExecutionRepository executionRepository;
    private final Clock clock;

    @Transactional
    public TriggerExecution create(Long triggerId) {
        TriggerExecution execution = executionRepository.save(TriggerExecution.builder()
                .triggerId(triggerId)
                .createdAt(clock.instant())
                .build());
        log.debug("Started execution: id={}, triggerId={}", execution.getId(), triggerId);
        return execution;
    }

    /**
     * @return false if the execution does not exist
     */
    @Transactional
    public boolean setCompleted(Long id, int exitCode, String logs) {
        Optional<TriggerExecution> found = executionRepository.findById(id);
        if (found.isEmpty()) {
            log.warn("Cannot complete unknown execution: id={}", id);
            return false;
        }
        TriggerExecution execution = found.get();
        execution.setExitCode(exitCode);
        execution.setLogs(logs != null ? logs : "");
        execution.setCompletedAt(clock.instant());
        executionRepository.save(execution);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<TriggerExecution> get(Long id) {
        return executionRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<TriggerExecution> getAll(ExecutionFilter filter) {
        Specification<TriggerExecution> spec = Specification.allOf(
                triggerIdIs(filter.getTriggerId()),
                exitCodeIs(filter.getExitCode()),
                completedIs(filter.getCompleted()));
        Pageable page = OffsetLimitRequest.of(filter.getLimit(), filter.getOffset(), NEWEST_FIRST);
        return page.isPaged()
                ? executionRepository.findAll(spec, page).getContent()
                : executionRepository.findAll(spec, NEWEST_FIRST);
    }

    private static Specification<TriggerExecution> triggerIdIs(Long triggerId) {
        return (root, query, cb) -> triggerId == null
                ? cb.conjunction()
                : cb.equal(root.get("triggerId"), triggerId);
    }

    private static Specification<TriggerExecution> exitCodeIs(Integer exitCode) {
        return (root, query, cb) -> exitCode == null
                ? cb.conjunction()
                : cb.equal(root.get("exitCode"), exitCode);
    }

    private static Specification<TriggerExecution> completedIs(Boolean completed) {
        if (completed == null) {
            return (root, query, cb) -> cb.conjunction();
        }
        return (root, query, cb) -> completed
                ? cb.isNotNull(root.get("completedAt"))
                : cb.isNull(root.get("completedAt"));
    }
}
