package com.triggerd.events;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads the event batch the daemon wrote to the script's stdin.
 *
 * The stream is read once and the result cached. Empty stdin (a pure cron
 * trigger) yields no events; anything else must be a valid batch or
 * {@link InvalidEventBatchException} is thrown.
 */
@Slf4j
public class StdinEventSource implements EventSource {

    public static final String KIND = "stdin";

    private final InputStream in;
    private final EventBatchCodec codec;
    private List<BatchEvent> events;

    public StdinEventSource(InputStream in, EventBatchCodec codec) {
        this.in = in;
        this.codec = codec;
    }

    public StdinEventSource() {
        this(System.in, EventBatchCodec.standalone());
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public synchronized List<BatchEvent> getEvents() {
        if (events == null) {
            events = read();
        }
        return events;
    }

    private List<BatchEvent> read() {
        String content;
        try {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read events from stdin", e);
        }
        if (content.isEmpty()) {
            log.debug("No data available on stdin");
            return List.of();
        }
        List<BatchEvent> decoded = List.copyOf(codec.decode(content).getEvents());
        log.info("Loaded {} events from stdin", decoded.size());
        return decoded;
    }
}
