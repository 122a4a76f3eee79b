package com.triggerd.daemon;

import com.triggerd.config.TriggerdProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Holds the PID file for the lifetime of a foreground daemon.
 *
 * LIFECYCLE:
 *   context refresh  → live PID in file?  YES → DaemonAlreadyRunningException (exit 78), file untouched
 *                                          NO  → create the file with own PID; if another
 *                                                daemon created it first → DaemonAlreadyRunningException
 *   context close    → scheduler drains first (SmartLifecycle stop), then the file is removed
 *
 * Only active with triggerd.daemon.manage-pid-file=true, which run-foreground sets.
 */
@Component
@ConditionalOnProperty(prefix = "triggerd.daemon", name = "manage-pid-file", havingValue = "true")
@Slf4j
public class DaemonPidFile {

    private final PidFile pidFile;
    private final long ownPid = ProcessHandle.current().pid();

    @Autowired
    public DaemonPidFile(TriggerdProperties properties) {
        this(new PidFile(properties.resolvePidFile()));
    }

    DaemonPidFile(PidFile pidFile) {
        this.pidFile = pidFile;
    }

    @PostConstruct
    public void acquire() {
        OptionalLong running = pidFile.runningPid();
        if (running.isPresent()) {
            if (running.getAsLong() != ownPid) {
                refuse(running);
            }
            log.info("PID file already names this process: pid={}", ownPid);
            return;
        }
        if (!pidFile.create(ownPid)) {
            refuse(pidFile.read());
        }
        log.info("Starting daemon with PID {}", ownPid);
    }

    private void refuse(OptionalLong running) {
        log.error("Daemon already running: pid={}, pidFile={}",
                running.isPresent() ? running.getAsLong() : "unknown", pidFile.getPath());
        throw new DaemonAlreadyRunningException(pidFile.getPath(), running);
    }

    @PreDestroy
    public void release() {
        OptionalLong recorded = pidFile.read();
        if (recorded.isPresent() && recorded.getAsLong() == ownPid) {
            pidFile.remove();
            log.info("Removed PID file: path={}", pidFile.getPath());
        }
    }
}
