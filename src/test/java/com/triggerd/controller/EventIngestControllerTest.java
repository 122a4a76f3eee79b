package com.triggerd.controller;

import com.triggerd.config.AppConfig;
import com.triggerd.dto.EventRequest;
import com.triggerd.model.Event;
import com.triggerd.service.EventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventIngestController.class)
@Import(AppConfig.class)
class EventIngestControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private EventStore eventStore;

    @Test
    @DisplayName("POST /v1/events/ingest should store every event and report the count")
    @SuppressWarnings("unchecked")
    void ingest_storesEvents() throws Exception {
        when(eventStore.createMany(anyList())).thenReturn(List.of(new Event(), new Event()));

        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"events": [
                                  {"name": "message_created", "source": "slack",
                                   "data": {"text": "hi"}, "timestamp": "2025-01-01T10:00:00Z"},
                                  {"name": "message_deleted",
                                   "data": {}, "timestamp": "2025-01-01T10:00:01Z"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(2));

        ArgumentCaptor<List<EventRequest>> captor = ArgumentCaptor.forClass(List.class);
        verify(eventStore).createMany(captor.capture());
        List<EventRequest> stored = captor.getValue();
        assertEquals(2, stored.size());
        assertEquals("message_created", stored.get(0).getName());
        assertEquals("slack", stored.get(0).getSource());
        assertEquals("hi", stored.get(0).getData().get("text"));
        assertEquals(Instant.parse("2025-01-01T10:00:00Z"), stored.get(0).getTimestamp());
        assertNull(stored.get(1).getSource());
    }

    @Test
    @DisplayName("POST /v1/events/ingest should accept an empty batch")
    void ingest_emptyBatch() throws Exception {
        when(eventStore.createMany(anyList())).thenReturn(List.of());

        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": []}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(0));
    }

    @Test
    @DisplayName("POST /v1/events/ingest should reject events missing required fields with 400")
    void ingest_missingFields() throws Exception {
        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": [{\"name\": \"\", \"data\": {}}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message")
                        .value("events[0].name: name is required, events[0].timestamp: timestamp is required"));

        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("POST /v1/events/ingest should reject a null entry in the events list with 400")
    void ingest_nullEvent() throws Exception {
        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": [null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("events[0]: event is required"));

        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("POST /v1/events/ingest should reject a body without an events list")
    void ingest_missingEvents() throws Exception {
        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("events: events is required"));

        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("POST /v1/events/ingest should reject malformed JSON with 400")
    void ingest_malformedJson() throws Exception {
        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": [}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));

        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("an unexpected store failure should map to 500")
    void ingest_storeFailure() throws Exception {
        when(eventStore.createMany(anyList())).thenThrow(new IllegalStateException("disk full"));

        mockMvc.perform(post("/v1/events/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": [{\"name\": \"a\", \"data\": {}, \"timestamp\": \"2025-01-01T10:00:00Z\"}]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    @Test
    @DisplayName("GET /v1/health should report ok")
    void health_ok() throws Exception {
        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    @DisplayName("GET on the ingest path should be 405")
    void ingest_wrongMethod() throws Exception {
        mockMvc.perform(get("/v1/events/ingest"))
                .andExpect(status().isMethodNotAllowed());
    }
}
