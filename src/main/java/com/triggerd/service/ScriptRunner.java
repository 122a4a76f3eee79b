package com.triggerd.service;

import com.triggerd.config.TriggerdProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a trigger script as a child process:
 *
 *   <runtime> run <script_path>      (runtime = triggerd.scheduler.runtime, "uv" by default)
 *
 * stdin is fed from a temp file holding the event batch, or is empty. stdout
 * and stderr go to one temp file so their interleaving is kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScriptRunner {

    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final TriggerdProperties properties;

    /**
     * @param stdin text for the script's stdin, or null for an empty stdin
     */
    public ScriptResult run(String scriptPath, String stdin, Duration timeout)
            throws IOException, InterruptedException, ScriptTimeoutException {
        List<String> command = List.of(properties.getScheduler().getRuntime(), "run", scriptPath);
        Path output = Files.createTempFile("triggerd-output-", ".log");
        Path input = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
            if (stdin != null) {
                input = Files.createTempFile("triggerd-batch-", ".json");
                Files.writeString(input, stdin, StandardCharsets.UTF_8);
                builder.redirectInput(input.toFile());
            }

            log.debug("Starting script: command={}", command);
            Process process = builder.start();
            if (stdin == null) {
                process.getOutputStream().close();
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Script timed out, killing: script={}, pid={}", scriptPath, process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                throw new ScriptTimeoutException(timeout, read(output));
            }
            return new ScriptResult(process.exitValue(), read(output));
        } finally {
            Files.deleteIfExists(output);
            if (input != null) {
                Files.deleteIfExists(input);
            }
        }
    }

    private static String read(Path output) throws IOException {
        // Malformed UTF-8 is replaced, not rejected
        return new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    }
}
