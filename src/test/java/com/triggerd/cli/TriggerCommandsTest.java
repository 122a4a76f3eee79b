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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TriggerCommandsTest {

    @Mock private TriggerStore triggerStore;
    @Mock private EventStore eventStore;
    @Mock private ExecutionStore executionStore;
    @Mock private TriggerExecutor triggerExecutor;
    @InjectMocks private TriggerCommands commands;

    @TempDir Path tempDir;

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Trigger trigger(String name) {
        return Trigger.builder()
                .id(1L)
                .name(name)
                .cronSchedule("0 * * * *")
                .scriptPath("/scripts/a.py")
                .createdAt(Instant.parse("2025-01-01T10:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        @DisplayName("should store the absolute script path and the event filter")
        void add_storesTrigger() throws Exception {
            Path script = Files.writeString(tempDir.resolve("a.py"), "print('hi')");
            when(triggerStore.create(any(TriggerDefinition.class))).thenReturn(trigger("daily"));

            int code = commands.add(CliArguments.parse(List.of(
                    "--name", "daily", "--cron", "0 * * * *", "--script", script.toString(),
                    "--event-name", "message_created", "--event-source", "slack")), out);

            assertEquals(ExitCodes.OK, code);
            ArgumentCaptor<TriggerDefinition> captor = ArgumentCaptor.forClass(TriggerDefinition.class);
            verify(triggerStore).create(captor.capture());
            TriggerDefinition definition = captor.getValue();
            assertEquals("daily", definition.getName());
            assertEquals(script.toAbsolutePath().toString(), definition.getScriptPath());
            assertEquals(Set.of("message_created"), definition.getEventNames());
            assertEquals(Set.of("slack"), definition.getEventSources());
            assertEquals("Added trigger 'daily'", output().strip());
        }

        @Test
        @DisplayName("should refuse a script that does not exist")
        void add_missingScript() {
            CliArguments args = CliArguments.parse(List.of(
                    "--cron", "0 * * * *", "--script", tempDir.resolve("missing.py").toString()));

            TriggerConfigurationException e = assertThrows(TriggerConfigurationException.class,
                    () -> commands.add(args, out));
            assertTrue(e.getMessage().endsWith("does not exist"));
            verifyNoInteractions(triggerStore);
        }

        @Test
        @DisplayName("should refuse a directory as script")
        void add_directory() {
            CliArguments args = CliArguments.parse(List.of("--cron", "0 * * * *", "--script", tempDir.toString()));

            assertThrows(TriggerConfigurationException.class, () -> commands.add(args, out));
        }

        @Test
        @DisplayName("should require --cron")
        void add_requiresCron() {
            assertThrows(UsageException.class,
                    () -> commands.add(CliArguments.parse(List.of("--script", "a.py")), out));
        }
    }

    @Test
    @DisplayName("list should print a row per trigger")
    void list_printsRows() {
        Trigger eventBased = trigger("on-message");
        eventBased.setEventNames(Set.of("message_created"));
        eventBased.setEnabled(false);
        when(triggerStore.getAll(any(TriggerFilter.class))).thenReturn(List.of(trigger("daily"), eventBased));

        commands.list(out);

        List<String> lines = output().lines().collect(Collectors.toList());
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("NAME"));
        assertTrue(lines.get(1).startsWith("daily"));
        assertTrue(lines.get(2).contains("disabled"));
        assertTrue(lines.get(2).contains("name=message_created"));
    }

    @Test
    @DisplayName("list should say so when there are no triggers")
    void list_empty() {
        when(triggerStore.getAll(any(TriggerFilter.class))).thenReturn(List.of());

        commands.list(out);

        assertEquals("No triggers found", output().strip());
    }

    @Test
    @DisplayName("show should print recent executions with the tail of their logs")
    void show_printsExecutions() {
        when(triggerStore.requireByName("daily")).thenReturn(trigger("daily"));
        String logs = IntStream.rangeClosed(1, 12).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
        TriggerExecution failed = TriggerExecution.builder()
                .id(3L).triggerId(1L)
                .createdAt(Instant.parse("2025-01-01T11:00:00Z"))
                .completedAt(Instant.parse("2025-01-01T11:00:01Z"))
                .exitCode(3).logs(logs)
                .build();
        TriggerExecution running = TriggerExecution.builder()
                .id(4L).triggerId(1L)
                .createdAt(Instant.parse("2025-01-01T12:00:00Z"))
                .build();
        when(executionStore.getAll(any(ExecutionFilter.class))).thenReturn(List.of(running, failed));

        commands.show("daily", out);

        String text = output();
        assertTrue(text.contains("Trigger: daily"));
        assertTrue(text.contains("[running]"));
        assertTrue(text.contains("[failed]"));
        assertTrue(text.contains("(exit: 3)"));
        assertTrue(text.contains("line 12"));
        assertTrue(text.contains("line 3"));
        assertFalse(text.contains("line 2\n"));
    }

    @Test
    @DisplayName("show of an unknown trigger should fail")
    void show_unknown() {
        when(triggerStore.requireByName("ghost")).thenThrow(new EntityNotFoundException("Trigger not found: ghost"));

        assertThrows(EntityNotFoundException.class, () -> commands.show("ghost", out));
    }

    @Test
    @DisplayName("enable on an enabled trigger should report it and change nothing")
    void setEnabled_alreadyEnabled() {
        when(triggerStore.requireByName("daily")).thenReturn(trigger("daily"));

        assertEquals(ExitCodes.OK, commands.setEnabled("daily", true, out));

        verify(triggerStore, never()).setEnabled(any(), anyBoolean());
        assertEquals("Trigger 'daily' is already enabled", output().strip());
    }

    @Test
    @DisplayName("disable should flip the flag")
    void setEnabled_disables() {
        when(triggerStore.requireByName("daily")).thenReturn(trigger("daily"));
        when(triggerStore.setEnabled("daily", false)).thenReturn(true);

        assertEquals(ExitCodes.OK, commands.setEnabled("daily", false, out));
        assertEquals("Disabled trigger 'daily'", output().strip());
    }

    @Test
    @DisplayName("remove of an unknown trigger should fail")
    void remove_unknown() {
        when(triggerStore.deleteByName("ghost")).thenReturn(false);

        assertThrows(EntityNotFoundException.class, () -> commands.remove("ghost", out));
    }

    @Test
    @DisplayName("reset should report how many triggers were removed")
    void reset_reportsCount() {
        when(triggerStore.deleteAll()).thenReturn(2L);

        commands.reset(out);

        assertEquals("Reset trigger database (2 triggers removed)", output().strip());
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("should skip an event-based trigger without new events")
        void run_noEvents() {
            Trigger trigger = trigger("on-message");
            trigger.setEventNames(Set.of("message_created"));
            when(triggerStore.requireByName("on-message")).thenReturn(trigger);
            when(eventStore.getEventsForTrigger(trigger, false)).thenReturn(List.of());

            assertEquals(ExitCodes.OK, commands.run("on-message", out));

            verifyNoInteractions(triggerExecutor);
        }

        @Test
        @DisplayName("should hand unconsumed events to the executor")
        void run_withEvents() {
            Trigger trigger = trigger("on-message");
            trigger.setEventNames(Set.of("message_created"));
            List<Event> events = List.of(Event.builder().id(5L).name("message_created").build());
            when(triggerStore.requireByName("on-message")).thenReturn(trigger);
            when(eventStore.getEventsForTrigger(trigger, false)).thenReturn(events);
            when(triggerExecutor.executeTrigger(trigger, events, true))
                    .thenReturn(TriggerExecution.builder().id(9L).exitCode(0).build());

            assertEquals(ExitCodes.OK, commands.run("on-message", out));
            assertTrue(output().contains("Execution 9 finished with exit code 0"));
        }

        @Test
        @DisplayName("a failing script should give exit code 1")
        void run_failure() {
            Trigger trigger = trigger("daily");
            when(triggerStore.requireByName("daily")).thenReturn(trigger);
            when(triggerExecutor.executeTrigger(trigger, List.of(), true))
                    .thenReturn(TriggerExecution.builder().id(9L).exitCode(TriggerExecution.EXIT_TIMEOUT).build());

            assertEquals(ExitCodes.ERROR, commands.run("daily", out));
            verifyNoInteractions(eventStore);
        }
    }

    @Test
    @DisplayName("tail() should keep the last ten lines")
    void tail_keepsLastLines() {
        String logs = IntStream.rangeClosed(1, 15).mapToObj(Integer::toString).collect(Collectors.joining("\n"));

        List<String> tail = TriggerCommands.tail(logs);

        assertEquals(10, tail.size());
        assertEquals("6", tail.get(0));
        assertTrue(TriggerCommands.tail(null).isEmpty());
    }
}
