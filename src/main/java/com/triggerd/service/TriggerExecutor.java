package com.triggerd.service;

import com.triggerd.config.TriggerdProperties;
import com.triggerd.events.EventBatchCodec;
import com.triggerd.model.Event;
import com.triggerd.model.Trigger;
import com.triggerd.model.TriggerExecution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one trigger once and records the outcome.
 *
 * FLOW:
 *   1. Create execution record (completed_at = null)
 *   2. Mark the supplied events consumed for this trigger and execution
 *   3. Run the script with the event batch on stdin (empty stdin for pure cron triggers)
 *   4. Complete the record with the exit code and captured output
 *
 * Exit codes stored:
 *   n  → the script's own exit code
 *   -1 → timed out and killed
 *   -2 → anything else went wrong (script missing, duplicate consumption, ...)
 *
 * Events are consumed before the script runs. A script that crashes does not
 * get the same events again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerExecutor {

    private final TriggerStore triggerStore;
    private final EventStore eventStore;
    private final ExecutionStore executionStore;
    private final ScriptRunner scriptRunner;
    private final EventBatchCodec eventBatchCodec;
    private final TriggerdProperties properties;
    private final Clock clock;

    /**
     * Scheduler entry point: advances the schedule first, so a slow script
     * cannot make the next poll dispatch the same occurrence again.
     *
     * @param onRescheduled runs once the new next_run_at is committed (or the
     *                      update failed), before the script starts
     */
    public TriggerExecution executeFromScheduler(Trigger trigger, List<Event> events, Runnable onRescheduled) {
        try {
            if (trigger.isEnabled() && trigger.getCronSchedule() != null) {
                triggerStore.updateNextRunTime(trigger.getId(), clock.instant());
            }
        } finally {
            onRescheduled.run();
        }
        return executeTrigger(trigger, events, false);
    }

    /**
     * Runs the trigger without touching its schedule. Never throws for script
     * or bookkeeping failures; they end up in the returned record.
     *
     * @param showOutput echo the captured output to stdout (CLI "run")
     */
    public TriggerExecution executeTrigger(Trigger trigger, List<Event> events, boolean showOutput) {
        TriggerExecution execution = executionStore.create(trigger.getId());
        log.info("Executing trigger: name={}, executionId={}, events={}",
                trigger.getName(), execution.getId(), events.size());

        int exitCode;
        String logs;
        try {
            List<Long> eventIds = events.stream().map(Event::getId).collect(Collectors.toList());
            eventStore.markEventsTriggered(trigger.getId(), eventIds, execution.getId());

            String stdin = trigger.isEventBased() ? eventBatchCodec.encode(events) : null;
            ScriptResult result = scriptRunner.run(trigger.getScriptPath(), stdin,
                    properties.getScheduler().getExecutionTimeout());
            exitCode = result.getExitCode();
            logs = result.getOutput();
        } catch (ScriptTimeoutException e) {
            exitCode = TriggerExecution.EXIT_TIMEOUT;
            logs = e.getMessage() + "\n" + e.getPartialOutput();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = TriggerExecution.EXIT_FAILED;
            logs = "Execution failed: interrupted";
        } catch (Exception e) {
            log.error("Trigger execution failed: name={}, executionId={}",
                    trigger.getName(), execution.getId(), e);
            exitCode = TriggerExecution.EXIT_FAILED;
            logs = "Execution failed: " + e.getMessage();
        }

        executionStore.setCompleted(execution.getId(), exitCode, logs);
        execution.setExitCode(exitCode);
        execution.setLogs(logs);
        execution.setCompletedAt(clock.instant());

        if (exitCode == 0) {
            log.info("Trigger completed: name={}, executionId={}", trigger.getName(), execution.getId());
        } else {
            log.warn("Trigger finished with errors: name={}, executionId={}, exitCode={}",
                    trigger.getName(), execution.getId(), exitCode);
        }
        if (showOutput) {
            PrintStream out = System.out;
            out.print(logs);
            if (!logs.endsWith("\n")) {
                out.println();
            }
        }
        return execution;
    }
}
