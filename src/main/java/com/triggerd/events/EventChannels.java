package com.triggerd.events;

import com.triggerd.config.TriggerdProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds sinks and sources from triggerd.sink / triggerd.source.
 *
 *   kind: http   → HttpEventSink posting to daemon-url
 *   kind: memory → MemoryEventSink / MemoryEventSource
 *   kind: stdin  → StdinEventSource over System.in
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventChannels {

    private final TriggerdProperties properties;
    private final RestTemplateBuilder restTemplateBuilder;
    private final EventBatchCodec codec;
    private final Clock clock;

    public EventSink createSink() {
        return createSink(properties.getSink());
    }

    public EventSink createSink(TriggerdProperties.Sink config) {
        EventSink sink = switch (config.getKind()) {
            case HttpEventSink.KIND -> new HttpEventSink(
                    new DaemonClient(restTemplateBuilder, config.getDaemonUrl(),
                            config.getTimeout(), config.getHeaders()),
                    config.getSourceName(), config.getBatchSize(), config.getBatchTimeout(), clock);
            case MemoryEventSink.KIND -> new MemoryEventSink(config.getSourceName(), clock);
            default -> throw new IllegalArgumentException("Unknown sink type: " + config.getKind());
        };
        log.debug("{} EventSink created", config.getKind());
        return sink;
    }

    public EventSource createSource() {
        return createSource(properties.getSource());
    }

    public EventSource createSource(TriggerdProperties.Source config) {
        EventSource source = switch (config.getKind()) {
            case StdinEventSource.KIND -> new StdinEventSource(System.in, codec);
            case MemoryEventSource.KIND -> new MemoryEventSource(
                    new MemoryEventSink(properties.getSink().getSourceName(), clock));
            default -> throw new IllegalArgumentException("Unknown source type: " + config.getKind());
        };
        log.debug("{} EventSource created", config.getKind());
        return source;
    }
}
