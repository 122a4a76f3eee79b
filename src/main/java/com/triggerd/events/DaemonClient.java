package com.triggerd.events;

import com.triggerd.dto.EventRequest;
import com.triggerd.dto.IngestEventsRequest;
import com.triggerd.dto.IngestEventsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP client for the daemon's /v1 endpoints.
 */
@Slf4j
public class DaemonClient {

    private final RestTemplate restTemplate;

    public DaemonClient(RestTemplateBuilder builder, String daemonUrl, Duration timeout,
                        Map<String, String> headers) {
        RestTemplateBuilder configured = builder
                .rootUri(daemonUrl)
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            configured = configured.defaultHeader(header.getKey(), header.getValue());
        }
        this.restTemplate = configured.build();
    }

    DaemonClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * @return the number of events the daemon acknowledged
     * @throws RestClientException if the daemon is unreachable or rejects the batch
     */
    public int sendEvents(List<EventRequest> events) {
        IngestEventsResponse response = restTemplate.postForObject("/v1/events/ingest",
                new IngestEventsRequest(events), IngestEventsResponse.class);
        int received = response != null ? response.getReceived() : 0;
        log.debug("Delivered events to daemon: sent={}, received={}", events.size(), received);
        return received;
    }

    public boolean isHealthy() {
        try {
            Map<?, ?> body = restTemplate.getForObject("/v1/health", Map.class);
            return body != null && "ok".equals(body.get("status"));
        } catch (RestClientException e) {
            log.debug("Daemon health check failed: {}", e.getMessage());
            return false;
        }
    }
}
