package com.triggerd.service;

import com.triggerd.config.TriggerdProperties;
import com.triggerd.model.Event;
import com.triggerd.model.Trigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Polls for due triggers and dispatches them to a bounded worker pool.
 *
 * FLOW (one tick, default every second):
 *   now = clock.instant()
 *        ↓
 *   getDueTriggers(now)  →  enabled AND next_run_at <= now, by id
 *        ↓
 *   event-based?  ── YES → unconsumed matching events?  ── NONE → skip, nothing recorded
 *        │                              │
 *        NO                            SOME
 *        ↓                              ↓
 *   submit executeFromScheduler(trigger, events) to the worker pool
 *   (blocks while all workers are busy and the queue is full)
 *
 * A single poller thread means ticks never overlap. Errors in a tick are
 * logged and the next tick runs as usual. A trigger is not submitted again
 * until its worker has committed the new next_run_at; after that, a later
 * occurrence may run alongside the script still in progress.
 *
 * SHUTDOWN (SIGTERM → Spring context close → stop()):
 *   1. running = false, wake the poller and wait for its current tick to end
 *   2. shut the pool down and wait for submitted executions to finish
 *   Nothing in flight is cancelled; only the per-execution timeout kills scripts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerScheduler implements SmartLifecycle {

    private static final Duration DRAIN_LOG_INTERVAL = Duration.ofSeconds(30);

    private final TriggerStore triggerStore;
    private final EventStore eventStore;
    private final TriggerExecutor triggerExecutor;
    private final TriggerdProperties properties;
    private final Clock clock;

    // Dispatched, and next_run_at not yet advanced by the worker. The poller
    // must not submit these a second time.
    private final Set<Long> queued = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private volatile CountDownLatch stopSignal;
    private Thread poller;
    private ThreadPoolExecutor workerPool;

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isEnabled();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        TriggerdProperties.Scheduler config = properties.getScheduler();
        workerPool = newWorkerPool(config.getWorkerPoolSize(), config.getQueueCapacity());
        stopSignal = new CountDownLatch(1);
        running = true;

        poller = new Thread(this::pollLoop, "trigger-scheduler");
        poller.start();
        log.info("Trigger scheduler started: tickInterval={}, workers={}",
                config.getTickInterval(), config.getWorkerPoolSize());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping trigger scheduler");
        running = false;
        stopSignal.countDown();
        try {
            poller.join();
            workerPool.shutdown();
            while (!workerPool.awaitTermination(DRAIN_LOG_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Waiting for running executions: active={}, queued={}",
                        workerPool.getActiveCount(), workerPool.getQueue().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining executions: active={}", workerPool.getActiveCount());
        }
        log.info("Trigger scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduling pass. Visible for tests, which pass a same-thread executor.
     */
    void processTriggers(Executor pool, Instant now) {
        List<Trigger> due = triggerStore.getDueTriggers(now);
        for (Trigger trigger : due) {
            List<Event> events = List.of();
            if (trigger.isEventBased()) {
                events = eventStore.getEventsForTrigger(trigger, false);
                if (events.isEmpty()) {
                    log.debug("Skipping trigger without new events: name={}", trigger.getName());
                    continue;
                }
            }
            if (!queued.add(trigger.getId())) {
                log.debug("Previous dispatch not rescheduled yet: name={}", trigger.getName());
                continue;
            }
            log.info("Dispatching trigger: name={}, events={}", trigger.getName(), events.size());
            List<Event> batch = events;
            try {
                pool.execute(() -> run(trigger, batch));
            } catch (RuntimeException e) {
                queued.remove(trigger.getId());
                throw e;
            }
        }
    }

    private void run(Trigger trigger, List<Event> events) {
        Long id = trigger.getId();
        try {
            // Released only after next_run_at moved, so no tick sees this occurrence as due again
            triggerExecutor.executeFromScheduler(trigger, events, () -> queued.remove(id));
        } catch (Exception e) {
            log.error("Scheduled execution failed: name={}", trigger.getName(), e);
        } finally {
            queued.remove(id);
        }
    }

    private void pollLoop() {
        Duration tick = properties.getScheduler().getTickInterval();
        while (running) {
            try {
                processTriggers(workerPool, clock.instant());
            } catch (Exception e) {
                log.error("Scheduler tick failed", e);
            }
            try {
                if (stopSignal.await(tick.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private static ThreadPoolExecutor newWorkerPool(int workers, int queueCapacity) {
        return new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new NamedThreadFactory("trigger-worker"),
                blockUntilQueued());
    }

    /**
     * Makes submission block instead of failing when the pool is saturated.
     */
    private static RejectedExecutionHandler blockUntilQueued() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Worker pool is shut down");
            }
            try {
                executor.getQueue().put(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("Interrupted while waiting for a free worker", e);
            }
        };
    }
}
