package com.triggerd;

import com.triggerd.cli.CliArguments;
import com.triggerd.cli.UsageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerdApplicationTest {

    @Test
    @DisplayName("run-foreground should always enable the scheduler and the PID file")
    void foregroundProperties_defaults() {
        List<String> properties = List.of(TriggerdApplication.foregroundProperties(CliArguments.parse(List.of())));

        assertEquals(List.of("--triggerd.scheduler.enabled=true", "--triggerd.daemon.manage-pid-file=true"),
                properties);
    }

    @Test
    @DisplayName("log file, host and port should map onto Spring properties")
    void foregroundProperties_renamesKnownOptions() {
        List<String> properties = List.of(TriggerdApplication.foregroundProperties(CliArguments.parse(List.of(
                "--log-file", "/tmp/d.log", "--host", "0.0.0.0", "--port", "9000"))));

        assertTrue(properties.contains("--logging.file.name=/tmp/d.log"));
        assertTrue(properties.contains("--server.address=0.0.0.0"));
        assertTrue(properties.contains("--server.port=9000"));
    }

    @Test
    @DisplayName("other options should pass through as properties")
    void foregroundProperties_passesThrough() {
        List<String> properties = List.of(TriggerdApplication.foregroundProperties(
                CliArguments.parse(List.of("--triggerd.home=/srv/triggerd"))));

        assertTrue(properties.contains("--triggerd.home=/srv/triggerd"));
    }

    @Test
    @DisplayName("positional arguments should be rejected")
    void foregroundProperties_rejectsPositionals() {
        assertThrows(UsageException.class,
                () -> TriggerdApplication.foregroundProperties(CliArguments.parse(List.of("now"))));
    }
}
