package com.triggerd.dto;

import lombok.*;

import java.util.Set;

/**
 * Partial update of a trigger. A null field means "leave unchanged"; pass an
 * empty set to clear an event filter.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerUpdate {

    private Boolean enabled;
    private String cronSchedule;
    private String scriptPath;
    private Set<String> eventNames;
    private Set<String> eventSources;

    public boolean isEmpty() {
        return enabled == null && cronSchedule == null && scriptPath == null
                && eventNames == null && eventSources == null;
    }
}
