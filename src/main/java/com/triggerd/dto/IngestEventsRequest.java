package com.triggerd.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestEventsRequest {

    @NotNull(message = "events is required")
    private List<@NotNull(message = "event is required") @Valid EventRequest> events;
}
