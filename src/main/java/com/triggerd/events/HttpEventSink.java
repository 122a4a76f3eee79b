package com.triggerd.events;

import com.triggerd.dto.EventRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers events and posts them to the daemon in batches.
 *
 * A batch is sent when it reaches batchSize, or on the first send after
 * batchTimeout has passed since the last flush. There is no background timer,
 * so close() is what guarantees the tail of the stream is delivered.
 *
 * A failed post keeps the batch buffered and rethrows, so a later flush
 * retries it.
 */
@Slf4j
public class HttpEventSink extends AbstractEventSink {

    public static final String KIND = "http";

    private final DaemonClient client;
    private final int batchSize;
    private final Duration batchTimeout;
    private final Clock clock;

    private final List<EventRequest> batch = new ArrayList<>();
    private Instant lastFlush;

    public HttpEventSink(DaemonClient client, String sourceName, int batchSize,
                         Duration batchTimeout, Clock clock) {
        super(sourceName, clock);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        this.client = client;
        this.batchSize = batchSize;
        this.batchTimeout = batchTimeout;
        this.clock = clock;
        this.lastFlush = clock.instant();
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    protected synchronized void doSend(EventRequest event) {
        batch.add(event);
        if (shouldFlush()) {
            flush();
        }
    }

    @Override
    public synchronized void flush() {
        if (batch.isEmpty()) {
            return;
        }
        client.sendEvents(List.copyOf(batch));
        log.debug("Flushed event batch: size={}", batch.size());
        batch.clear();
        lastFlush = clock.instant();
    }

    synchronized int pending() {
        return batch.size();
    }

    private boolean shouldFlush() {
        return batch.size() >= batchSize
                || !clock.instant().isBefore(lastFlush.plus(batchTimeout));
    }
}
