package com.triggerd.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExecutionFilter {

    private Long triggerId;
    private Integer exitCode;
    // null = all, true = completed, false = still running (or crashed)
    private Boolean completed;
    private Integer limit;
    private Integer offset;

    public static ExecutionFilter all() {
        return new ExecutionFilter();
    }
}
