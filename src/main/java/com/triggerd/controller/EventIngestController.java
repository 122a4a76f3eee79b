package com.triggerd.controller;

import com.triggerd.dto.IngestEventsRequest;
import com.triggerd.dto.IngestEventsResponse;
import com.triggerd.service.EventStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * The only external write path into the events table.
 *
 * POST /v1/events/ingest
 * {
 *   "events": [
 *     {"name": "message_created", "source": "slack",
 *      "data": {"text": "hi"}, "timestamp": "2025-01-01T10:00:00Z"}
 *   ]
 * }
 * → 200 {"received": 1}
 *
 * GET /v1/health → 200 {"status": "ok"}
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class EventIngestController {

    private final EventStore eventStore;

    @PostMapping("/events/ingest")
    public ResponseEntity<IngestEventsResponse> ingest(@Valid @RequestBody IngestEventsRequest request) {
        int received = eventStore.createMany(request.getEvents()).size();
        log.info("Ingested events: received={}", received);
        return ResponseEntity.ok(new IngestEventsResponse(received));
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
