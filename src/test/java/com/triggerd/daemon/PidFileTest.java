package com.triggerd.daemon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PidFileTest {

    @TempDir Path tempDir;

    @Test
    @DisplayName("missing file means not running")
    void missingFile_notRunning() {
        PidFile pidFile = new PidFile(tempDir.resolve("daemon.pid"));

        assertFalse(pidFile.isRunning());
        assertTrue(pidFile.read().isEmpty());
    }

    @Test
    @DisplayName("file naming a live process means running and is kept")
    void livePid_isRunning() {
        PidFile pidFile = new PidFile(tempDir.resolve("daemon.pid"));
        pidFile.create(ProcessHandle.current().pid());

        assertTrue(pidFile.isRunning());
        assertEquals(OptionalLong.of(ProcessHandle.current().pid()), pidFile.runningPid());
        assertTrue(Files.exists(pidFile.getPath()));
    }

    @Test
    @DisplayName("file naming a dead process is stale and gets removed")
    void deadPid_isStale() throws Exception {
        Process finished = new ProcessBuilder("true").start();
        finished.waitFor();
        PidFile pidFile = new PidFile(tempDir.resolve("daemon.pid"));
        pidFile.create(finished.pid());

        assertFalse(pidFile.isRunning());
        assertFalse(Files.exists(pidFile.getPath()));
    }

    @Test
    @DisplayName("garbage content is stale and gets removed")
    void garbage_isStale() throws Exception {
        Path path = tempDir.resolve("daemon.pid");
        Files.writeString(path, "not-a-pid\n");
        PidFile pidFile = new PidFile(path);

        assertTrue(pidFile.read().isEmpty());
        assertFalse(pidFile.isRunning());
        assertFalse(Files.exists(path));
    }

    @Test
    @DisplayName("create() should create missing parent directories")
    void create_createsParentDirectories() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("nested/dir/daemon.pid"));

        assertTrue(pidFile.create(42L));

        assertEquals(OptionalLong.of(42L), pidFile.read());
        try (Stream<Path> files = Files.list(pidFile.getPath().getParent())) {
            assertEquals(1, files.count());
        }
        pidFile.remove();
        assertFalse(Files.exists(pidFile.getPath()));
    }

    @Test
    @DisplayName("create() should leave an existing file untouched")
    void create_refusesExistingFile() {
        PidFile pidFile = new PidFile(tempDir.resolve("daemon.pid"));
        assertTrue(pidFile.create(42L));

        assertFalse(pidFile.create(43L));
        assertEquals(OptionalLong.of(42L), pidFile.read());
    }

    @Test
    @DisplayName("concurrent create() calls should have exactly one winner")
    void create_concurrentCallsHaveOneWinner() throws Exception {
        PidFile pidFile = new PidFile(tempDir.resolve("daemon.pid"));
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (long pid = 1; pid <= contenders; pid++) {
                long candidate = pid;
                results.add(pool.submit(() -> {
                    start.await();
                    return pidFile.create(candidate);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertTrue(pidFile.read().isPresent());
        } finally {
            pool.shutdownNow();
        }
    }
}
