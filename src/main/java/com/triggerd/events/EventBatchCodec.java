package com.triggerd.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.triggerd.model.Event;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes and reads the versioned stdin event batch. Both directions run the
 * same checks, so the daemon never hands a script a batch the script would
 * refuse.
 */
@Component
@RequiredArgsConstructor
public class EventBatchCodec {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * For code running outside a Spring context, e.g. inside a trigger script.
     */
    public static EventBatchCodec standalone() {
        ObjectMapper mapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        return new EventBatchCodec(mapper, Validation.buildDefaultValidatorFactory().getValidator());
    }

    public String encode(List<Event> events) {
        EventBatch batch = EventBatch.of(events.stream().map(BatchEvent::from).collect(Collectors.toList()));
        validate(batch);
        try {
            return objectMapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new InvalidEventBatchException("Cannot serialize event batch: " + e.getOriginalMessage(), e);
        }
    }

    public EventBatch decode(String json) {
        EventBatch batch;
        try {
            batch = objectMapper.readValue(json, EventBatch.class);
        } catch (JsonProcessingException e) {
            throw new InvalidEventBatchException("Malformed event batch: " + e.getOriginalMessage(), e);
        }
        if (batch == null) {
            throw new InvalidEventBatchException("Malformed event batch: expected a JSON object");
        }
        validate(batch);
        return batch;
    }

    public void validate(EventBatch batch) {
        Set<ConstraintViolation<EventBatch>> violations = validator.validate(batch);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidEventBatchException("Invalid event batch: " + details);
        }
        if (!EventBatch.SCHEMA.equals(batch.getSchema())) {
            throw new InvalidEventBatchException("Unknown event batch schema: " + batch.getSchema());
        }
        if (batch.getVersion() != EventBatch.VERSION) {
            throw new InvalidEventBatchException("Unsupported event batch version: " + batch.getVersion());
        }
    }
}
