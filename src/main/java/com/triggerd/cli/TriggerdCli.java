package com.triggerd.cli;

import com.triggerd.service.TriggerConfigurationException;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Dispatches "triggerd &lt;command&gt; [args]" to the command beans and maps
 * failures to exit codes:
 *
 *   0  success
 *   1  command failed (bad cron, unknown trigger, script missing, ...)
 *   2  bad command line
 *   78 daemon already running (run-foreground only)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TriggerdCli {

    public static final String USAGE = """
            Usage: triggerd <command> [options]

            Trigger commands:
              add --cron EXPR --script PATH [--name NAME]
                  [--event-name NAME]... [--event-source SOURCE]...
                                         Add a trigger (cron is 5 fields, e.g. "0 * * * *";
                                         day-of-month and day-of-week cannot both be set)
              list                       List all triggers
              show <name>                Show a trigger and its recent executions
              enable <name>              Enable a trigger
              disable <name>             Disable a trigger
              remove <name>              Remove a trigger
              reset                      Remove all triggers
              run <name>                 Run a trigger now, without touching its schedule

            Daemon commands:
              start [--host HOST] [--port PORT]
                                         Start the daemon in the background
              stop                       Stop the daemon
              status                     Show whether the daemon is running
              run-foreground [--log-file PATH] [--host HOST] [--port PORT]
                                         Run the daemon in this process
            """;

    private final TriggerCommands triggerCommands;
    private final DaemonCommands daemonCommands;

    public int run(String[] args) {
        return run(Arrays.asList(args), System.out, System.err);
    }

    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty() || args.get(0).equals("--help") || args.get(0).equals("help")) {
            (args.isEmpty() ? err : out).print(USAGE);
            return args.isEmpty() ? ExitCodes.USAGE : ExitCodes.OK;
        }
        String command = args.get(0);
        try {
            return dispatch(command, CliArguments.parse(args.subList(1, args.size())), out);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            err.print(USAGE);
            return ExitCodes.USAGE;
        } catch (TriggerConfigurationException | EntityNotFoundException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted");
            return ExitCodes.ERROR;
        } catch (Exception e) {
            log.debug("Command failed: command={}", command, e);
            err.println("Error: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private int dispatch(String command, CliArguments args, PrintStream out) throws Exception {
        return switch (command) {
            case "add" -> triggerCommands.add(args, out);
            case "list" -> triggerCommands.list(out);
            case "show" -> triggerCommands.show(args.requirePositional(0, "name"), out);
            case "enable" -> triggerCommands.setEnabled(args.requirePositional(0, "name"), true, out);
            case "disable" -> triggerCommands.setEnabled(args.requirePositional(0, "name"), false, out);
            case "remove" -> triggerCommands.remove(args.requirePositional(0, "name"), out);
            case "reset" -> triggerCommands.reset(out);
            case "run" -> triggerCommands.run(args.requirePositional(0, "name"), out);
            case "start" -> daemonCommands.start(args, out);
            case "stop" -> daemonCommands.stop(out);
            case "status" -> daemonCommands.status(out);
            default -> throw new UsageException("Unknown command '" + command + "'");
        };
    }
}
