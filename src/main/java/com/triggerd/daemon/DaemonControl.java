package com.triggerd.daemon;

import com.triggerd.TriggerdApplication;
import com.triggerd.config.TriggerdProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts, stops and inspects a background daemon through its PID file.
 *
 * STOP:
 *   SIGTERM → poll once per second up to triggerd.daemon.shutdown-wait (10s)
 *           → still alive? SIGKILL
 *           → remove PID file
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DaemonControl {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final TriggerdProperties properties;

    public PidFile pidFile() {
        return new PidFile(properties.resolvePidFile());
    }

    public DaemonStatus status() {
        PidFile pidFile = pidFile();
        OptionalLong pid = pidFile.runningPid();
        return new DaemonStatus(pid.isPresent(), pid.isPresent() ? pid.getAsLong() : null, pidFile.getPath());
    }

    /**
     * Spawns "run-foreground" in a detached JVM.
     *
     * @return false if a daemon is already running
     */
    public boolean start(String host, Integer port) throws IOException {
        if (pidFile().isRunning()) {
            return false;
        }
        Path logFile = properties.resolveLogFile();
        if (logFile.getParent() != null) {
            Files.createDirectories(logFile.getParent());
        }

        List<String> command = new ArrayList<>(javaLauncher());
        command.add("run-foreground");
        command.add("--log-file");
        command.add(logFile.toString());
        command.add("--triggerd.home=" + properties.getHome());
        if (host != null) {
            command.add("--host");
            command.add(host);
        }
        if (port != null) {
            command.add("--port");
            command.add(port.toString());
        }

        Process process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        process.getOutputStream().close();
        log.info("Spawned daemon: pid={}, logFile={}", process.pid(), logFile);
        return true;
    }

    /**
     * @return false if no daemon was running or it could not be killed
     */
    public boolean stop() throws InterruptedException {
        PidFile pidFile = pidFile();
        OptionalLong pid = pidFile.runningPid();
        if (pid.isEmpty()) {
            return false;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid.getAsLong());
        if (handle.isEmpty()) {
            pidFile.remove();
            return false;
        }
        ProcessHandle process = handle.get();
        log.info("Sending SIGTERM to daemon: pid={}", process.pid());
        process.destroy();

        long polls = Math.max(1, properties.getDaemon().getShutdownWait().toSeconds());
        for (long i = 0; i < polls; i++) {
            Thread.sleep(POLL_INTERVAL.toMillis());
            if (!process.isAlive()) {
                pidFile.remove();
                return true;
            }
        }

        log.warn("Daemon did not exit in time, sending SIGKILL: pid={}", process.pid());
        process.destroyForcibly();
        try {
            process.onExit().get(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Daemon survived SIGKILL: pid={}", process.pid(), e);
            return false;
        }
        pidFile.remove();
        return true;
    }

    private static List<String> javaLauncher() {
        String java = ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        String classPath = System.getProperty("java.class.path");
        if (!classPath.contains(File.pathSeparator) && classPath.endsWith(".jar")) {
            return List.of(java, "-jar", classPath);
        }
        return List.of(java, "-cp", classPath, TriggerdApplication.class.getName());
    }
}
