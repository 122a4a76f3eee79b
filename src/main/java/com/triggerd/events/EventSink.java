package com.triggerd.events;

import java.util.Map;

/**
 * Where producers push events. Implementations may buffer; callers flush or
 * close to make sure everything was delivered.
 *
 * Example:
 *   try (EventSink sink = channels.createSink()) {
 *       sink.send("message_created", Map.of("text", "hi"));
 *   }
 */
public interface EventSink extends AutoCloseable {

    String kind();

    /**
     * @param source overrides the sink's default source name when non-null
     */
    void send(String name, Map<String, Object> data, String source);

    default void send(String name, Map<String, Object> data) {
        send(name, data, null);
    }

    void flush();

    /**
     * Flushes buffered events and releases resources.
     */
    @Override
    void close();
}
