package com.triggerd.cli;

import com.triggerd.config.TriggerdProperties;
import com.triggerd.daemon.DaemonControl;
import com.triggerd.daemon.DaemonStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;

@Component
@RequiredArgsConstructor
public class DaemonCommands {

    private final DaemonControl daemonControl;
    private final TriggerdProperties properties;

    public int start(CliArguments args, PrintStream out) throws IOException {
        if (!daemonControl.start(args.option("host").orElse(null), args.intOption("port").orElse(null))) {
            out.println("Daemon is already running");
            return ExitCodes.OK;
        }
        out.println("Daemon started in background (logs: " + properties.resolveLogFile() + ")");
        return ExitCodes.OK;
    }

    public int stop(PrintStream out) throws InterruptedException {
        if (!daemonControl.status().isRunning()) {
            out.println("Daemon is not running");
            return ExitCodes.OK;
        }
        out.println("Stopping daemon...");
        if (daemonControl.stop()) {
            out.println("Daemon stopped successfully");
            return ExitCodes.OK;
        }
        out.println("Failed to stop daemon");
        return ExitCodes.ERROR;
    }

    public int status(PrintStream out) {
        DaemonStatus status = daemonControl.status();
        if (status.isRunning()) {
            out.println("Daemon is running (PID: " + status.getPid() + ")");
        } else {
            out.println("Daemon is not running");
        }
        return ExitCodes.OK;
    }
}
