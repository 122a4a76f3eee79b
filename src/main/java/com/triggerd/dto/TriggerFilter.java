package com.triggerd.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerFilter {

    private Boolean enabled;
    // true → only triggers with a cron schedule, false → only without
    private Boolean hasSchedule;
    private Integer limit;
    private Integer offset;

    public static TriggerFilter all() {
        return new TriggerFilter();
    }
}
