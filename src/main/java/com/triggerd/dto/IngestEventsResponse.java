package com.triggerd.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestEventsResponse {
    private int received;
}
