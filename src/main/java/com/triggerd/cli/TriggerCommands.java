package com.triggerd.cli;

import com.triggerd.dto.ExecutionFilter;
import com.triggerd.dto.TriggerDefinition;
import com.triggerd.dto.TriggerFilter;
import com.triggerd.model.Event;
import com.triggerd.model.Trigger;
import com.triggerd.model.TriggerExecution;
import com.triggerd.service.EventStore;
import com.triggerd.service.ExecutionStore;
import com.triggerd.service.TriggerConfigurationException;
import com.triggerd.service.TriggerExecutor;
import com.triggerd.service.TriggerStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Trigger management commands: add, list, show, enable, disable, remove,
 * reset, run. Each returns a process exit code; configuration problems are
 * thrown and turned into "Error: ..." by {@link TriggerdCli}.
 */
@Component
@RequiredArgsConstructor
public class TriggerCommands {

    private static final int RECENT_EXECUTIONS = 5;
    private static final int LOG_TAIL_LINES = 10;
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final TriggerStore triggerStore;
    private final EventStore eventStore;
    private final ExecutionStore executionStore;
    private final TriggerExecutor triggerExecutor;

    public int add(CliArguments args, PrintStream out) {
        String cron = args.requireOption("cron");
        String script = args.requireOption("script");

        Path path = Path.of(script);
        if (!Files.exists(path)) {
            throw new TriggerConfigurationException("Script path '" + script + "' does not exist");
        }
        if (!Files.isRegularFile(path)) {
            throw new TriggerConfigurationException("'" + script + "' is not a file");
        }

        Trigger trigger = triggerStore.create(TriggerDefinition.builder()
                .name(args.option("name").orElse(null))
                .cronSchedule(cron)
                .scriptPath(path.toAbsolutePath().normalize().toString())
                .eventNames(new LinkedHashSet<>(args.options("event-name")))
                .eventSources(new LinkedHashSet<>(args.options("event-source")))
                .build());
        out.println("Added trigger '" + trigger.getName() + "'");
        return ExitCodes.OK;
    }

    public int list(PrintStream out) {
        List<Trigger> triggers = triggerStore.getAll(TriggerFilter.all());
        if (triggers.isEmpty()) {
            out.println("No triggers found");
            return ExitCodes.OK;
        }
        String row = "%-24s %-10s %-16s %-20s %-19s %s%n";
        out.printf(row, "NAME", "STATUS", "SCHEDULE", "EVENTS", "CREATED", "SCRIPT");
        for (Trigger trigger : triggers) {
            out.printf(row,
                    trigger.getName(),
                    trigger.isEnabled() ? "enabled" : "disabled",
                    trigger.getCronSchedule(),
                    describeFilter(trigger),
                    format(trigger.getCreatedAt()),
                    trigger.getScriptPath());
        }
        return ExitCodes.OK;
    }

    public int show(String name, PrintStream out) {
        Trigger trigger = triggerStore.requireByName(name);

        out.println("Trigger: " + trigger.getName());
        out.println("  ID: " + trigger.getId());
        out.println("  Status: " + (trigger.isEnabled() ? "enabled" : "disabled"));
        out.println("  Schedule: " + trigger.getCronSchedule());
        out.println("  Next run: " + (trigger.getNextRunAt() != null ? format(trigger.getNextRunAt()) : "-"));
        out.println("  Events: " + describeFilter(trigger));
        out.println("  Script: " + trigger.getScriptPath());
        out.println("  Created: " + format(trigger.getCreatedAt()));

        List<TriggerExecution> executions = executionStore.getAll(ExecutionFilter.builder()
                .triggerId(trigger.getId())
                .limit(RECENT_EXECUTIONS)
                .build());
        if (executions.isEmpty()) {
            out.println();
            out.println("No executions found");
            return ExitCodes.OK;
        }

        out.println();
        out.println("Recent executions:");
        for (TriggerExecution execution : executions) {
            if (!execution.isCompleted()) {
                out.println("  [running] " + format(execution.getCreatedAt()));
                continue;
            }
            out.println("  [" + (execution.isSuccessful() ? "ok" : "failed") + "] "
                    + format(execution.getCompletedAt()) + " (exit: " + execution.getExitCode() + ")");
            for (String line : tail(execution.getLogs())) {
                out.println("      " + line);
            }
        }
        return ExitCodes.OK;
    }

    public int setEnabled(String name, boolean enabled, PrintStream out) {
        Trigger trigger = triggerStore.requireByName(name);
        String state = enabled ? "enabled" : "disabled";
        if (trigger.isEnabled() == enabled) {
            out.println("Trigger '" + name + "' is already " + state);
            return ExitCodes.OK;
        }
        if (!triggerStore.setEnabled(name, enabled)) {
            throw new EntityNotFoundException("Trigger not found: " + name);
        }
        out.println((enabled ? "Enabled" : "Disabled") + " trigger '" + name + "'");
        return ExitCodes.OK;
    }

    public int remove(String name, PrintStream out) {
        if (!triggerStore.deleteByName(name)) {
            throw new EntityNotFoundException("Trigger not found: " + name);
        }
        out.println("Removed trigger '" + name + "'");
        return ExitCodes.OK;
    }

    public int reset(PrintStream out) {
        long removed = triggerStore.deleteAll();
        out.println("Reset trigger database (" + removed + " triggers removed)");
        return ExitCodes.OK;
    }

    /**
     * Runs a trigger now, outside its schedule. Event-based triggers get
     * their unconsumed events, and are skipped when there are none.
     */
    public int run(String name, PrintStream out) {
        Trigger trigger = triggerStore.requireByName(name);
        List<Event> events = List.of();
        if (trigger.isEventBased()) {
            events = eventStore.getEventsForTrigger(trigger, false);
            if (events.isEmpty()) {
                out.println("No new events for trigger '" + name + "', nothing to run");
                return ExitCodes.OK;
            }
        }

        TriggerExecution execution = triggerExecutor.executeTrigger(trigger, events, true);
        out.println("Execution " + execution.getId() + " finished with exit code " + execution.getExitCode());
        return execution.isSuccessful() ? ExitCodes.OK : ExitCodes.ERROR;
    }

    // --- Formatting helpers ---

    private static String describeFilter(Trigger trigger) {
        if (!trigger.isEventBased()) {
            return "-";
        }
        StringBuilder filter = new StringBuilder();
        appendSet(filter, "name", trigger.getEventNames());
        appendSet(filter, "source", trigger.getEventSources());
        return filter.toString();
    }

    private static void appendSet(StringBuilder target, String label, Set<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        if (target.length() > 0) {
            target.append(' ');
        }
        target.append(label).append('=').append(String.join(",", values));
    }

    private static String format(Instant instant) {
        return instant == null ? "-" : TIME_FORMAT.format(instant);
    }

    static List<String> tail(String logs) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        List<String> lines = Arrays.asList(logs.split("\n"));
        return lines.subList(Math.max(0, lines.size() - LOG_TAIL_LINES), lines.size());
    }
}
