package com.triggerd.daemon;

import org.springframework.boot.ExitCodeGenerator;

import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * A second daemon was started while the PID file names a live process.
 * The process exits with 78 (EX_CONFIG).
 */
public class DaemonAlreadyRunningException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 78;

    public DaemonAlreadyRunningException(Path pidFile, OptionalLong runningPid) {
        super(runningPid.isPresent()
                ? "Daemon already running (PID " + runningPid.getAsLong() + ", PID file: " + pidFile + ")"
                : "Daemon already running (PID file: " + pidFile + ")");
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
