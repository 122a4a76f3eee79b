package com.triggerd.dto;

import lombok.*;

import java.util.Set;

/**
 * Everything needed to create a trigger. A null name lets the store assign
 * "trigger-{id}".
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerDefinition {

    private String name;
    private String cronSchedule;
    private String scriptPath;

    @Builder.Default
    private boolean enabled = true;

    private Set<String> eventNames;
    private Set<String> eventSources;
}
