package com.triggerd.dto;

import lombok.*;

import java.util.Set;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EventFilter {

    private Set<String> names;
    private Set<String> sources;
    private Integer limit;
    private Integer offset;

    public static EventFilter all() {
        return new EventFilter();
    }
}
