package com.triggerd.events;

import java.util.List;

/**
 * Where a trigger script pulls its events from.
 */
public interface EventSource {

    String kind();

    /**
     * Available events, oldest first. Never null.
     */
    List<BatchEvent> getEvents();
}
