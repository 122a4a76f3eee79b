package com.triggerd.dto;

import lombok.*;

import java.time.Instant;

/**
 * Error body for every non-2xx API response.
 *
 * {
 *   "error": "Bad Request",
 *   "message": "events[0].name: name is required",
 *   "timestamp": "2025-01-01T10:00:00Z"
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ErrorResponse {
    private String error;
    private String message;
    private Instant timestamp;
}
