package com.triggerd.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralizes scheduler, daemon and event-sink configuration.
 *
 * Bound from application.yml under "triggerd" prefix:
 *   triggerd:
 *     home: ~/.triggerd
 *     scheduler:
 *       tick-interval: 1s
 *       worker-pool-size: 4
 *       execution-timeout: 300s
 *       runtime: uv
 *     daemon:
 *       pid-file: ~/.triggerd/daemon.pid
 *       shutdown-wait: 10s
 *     sink:
 *       kind: http
 *       daemon-url: http://localhost:8000
 *
 * Every component that needs a path, a timeout or a pool size injects this
 * instead of hardcoding it.
 */
@Component
@ConfigurationProperties(prefix = "triggerd")
@Getter
@Setter
public class TriggerdProperties {

    private Path home = Path.of(System.getProperty("user.home"), ".triggerd");
    private Scheduler scheduler = new Scheduler();
    private Daemon daemon = new Daemon();
    private Sink sink = new Sink();
    private Source source = new Source();

    public Path resolvePidFile() {
        return daemon.getPidFile() != null ? daemon.getPidFile() : home.resolve("daemon.pid");
    }

    public Path resolveLogFile() {
        return daemon.getLogFile() != null ? daemon.getLogFile() : home.resolve("daemon.log");
    }

    @Getter
    @Setter
    public static class Scheduler {
        // false keeps the poll loop off, e.g. for one-shot CLI commands
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(1);
        private int workerPoolSize = 4;
        private int queueCapacity = 16;
        private Duration executionTimeout = Duration.ofSeconds(300);
        // Scripts are started as: <runtime> run <script_path>
        private String runtime = "uv";
        private ZoneId cronZone = ZoneId.of("UTC");
    }

    @Getter
    @Setter
    public static class Daemon {
        // Only the run-foreground process owns the PID file
        private boolean managePidFile = false;
        private Path pidFile;
        private Path logFile;
        private Duration shutdownWait = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Sink {
        private String kind = "http";
        private String sourceName = "unknown";
        private String daemonUrl = "http://localhost:8000";
        private int batchSize = 10;
        private Duration batchTimeout = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofSeconds(30);
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Source {
        private String kind = "stdin";
    }
}
