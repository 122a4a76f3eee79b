package com.triggerd.daemon;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * The daemon's single-instance marker: a file holding the PID of the running
 * daemon, ~/.triggerd/daemon.pid by default.
 *
 * A file that names a dead process, or that does not hold a number, is stale.
 * {@link #isRunning()} deletes stale files as it finds them.
 */
@Slf4j
public class PidFile {

    private final Path path;

    public PidFile(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public OptionalLong read() {
        if (!Files.exists(path)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(Files.readString(path, StandardCharsets.UTF_8).strip()));
        } catch (IOException | NumberFormatException e) {
            log.debug("Unreadable PID file: path={}, error={}", path, e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * Creates the file holding {@code pid}, failing if it already exists.
     *
     * @return false if another process holds the file
     */
    public boolean create(long pid) {
        Path dir = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(temp, Long.toString(pid), StandardCharsets.UTF_8);
            // A hard link appears with its content complete, and never replaces an existing file
            Files.createLink(path, temp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write PID file " + path, e);
        } finally {
            if (temp != null) {
                deleteTemp(temp);
            }
        }
    }

    public void remove() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Cannot remove PID file: path={}", path, e);
        }
    }

    /**
     * The PID of a live daemon, or empty after cleaning up a stale file.
     */
    public OptionalLong runningPid() {
        if (!Files.exists(path)) {
            return OptionalLong.empty();
        }
        OptionalLong pid = read();
        if (pid.isPresent() && isAlive(pid.getAsLong())) {
            return pid;
        }
        log.info("Removing stale PID file: path={}", path);
        remove();
        return OptionalLong.empty();
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Cannot remove temporary PID file: path={}", temp, e);
        }
    }

    public boolean isRunning() {
        return runningPid().isPresent();
    }

    static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
