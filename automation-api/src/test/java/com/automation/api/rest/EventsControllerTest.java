package com.automation.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EventsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // Every test uses its own event names so the shared in-memory store does not leak between tests
    private String prefix;

    @BeforeEach
    void setUp() {
        prefix = "test." + UUID.randomUUID() + ".";
    }

    private String event(String name, Instant occurred) {
        return """
            {"occurred": "%s", "event": "%s", "resource": {"prefect.resource.id": "test.resource.%s"}}
            """.formatted(occurred, name, UUID.randomUUID());
    }

    private void publish(List<String> events) throws Exception {
        mockMvc.perform(post("/api/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[" + String.join(",", events) + "]"))
            .andExpect(status().isNoContent());
    }

    private String prefixFilter(int limit) {
        return """
            {"filter": {"event": {"prefix": ["%s"]}, "order": "ASC"}, "limit": %d}
            """.formatted(prefix, limit);
    }

    @Test
    void createEvents_shouldAcceptBatch() throws Exception {
        Instant now = Instant.now();
        publish(List.of(event(prefix + "one", now), event(prefix + "two", now)));

        mockMvc.perform(post("/api/events/filter")
                .contentType(MediaType.APPLICATION_JSON)
                .content(prefixFilter(10)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.events.length()").value(2))
            .andExpect(jsonPath("$.events[0].received").exists());
    }

    @Test
    void createEvents_missingOccurred_shouldReturnBadRequest() throws Exception {
        String invalid = """
            [{"event": "%s", "resource": {"prefect.resource.id": "test.resource"}}]
            """.formatted(prefix + "broken");

        mockMvc.perform(post("/api/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invalid))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").exists());
    }

    @Test
    void createEvents_malformedJson_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"event\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(ApiExceptionHandler.MALFORMED_REQUEST));
    }

    @Test
    @DisplayName("Pages are followed through next_page until the result set is exhausted")
    void readEvents_shouldPageThroughResults() throws Exception {
        Instant base = Instant.now().minus(1, ChronoUnit.HOURS);
        List<String> events = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            events.add(event(prefix + i, base.plusSeconds(i)));
        }
        publish(events);

        MvcResult first = mockMvc.perform(post("/api/events/filter")
                .contentType(MediaType.APPLICATION_JSON)
                .content(prefixFilter(2)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(5))
            .andExpect(jsonPath("$.events[0].event").value(prefix + 0))
            .andReturn();

        List<String> seen = new ArrayList<>(names(first));
        String token = nextPage(first);
        while (token != null) {
            MvcResult page = mockMvc.perform(get("/api/events/filter/next").param("page-token", token))
                .andExpect(status().isOk())
                .andReturn();
            seen.addAll(names(page));
            token = nextPage(page);
        }

        assertThat(seen).containsExactly(prefix + 0, prefix + 1, prefix + 2, prefix + 3, prefix + 4);
    }

    @Test
    void readEvents_limitAboveMaximum_shouldReturnUnprocessable() throws Exception {
        mockMvc.perform(post("/api/events/filter")
                .contentType(MediaType.APPLICATION_JSON)
                .content(prefixFilter(51)))
            .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void readNextPage_tamperedToken_shouldReturnForbidden() throws Exception {
        List<String> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            events.add(event(prefix + i, Instant.now()));
        }
        publish(events);
        MvcResult first = mockMvc.perform(post("/api/events/filter")
                .contentType(MediaType.APPLICATION_JSON)
                .content(prefixFilter(1)))
            .andReturn();
        String token = nextPage(first);
        assertThat(token).isNotNull();

        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("A") ? "BB" : "AA");

        mockMvc.perform(get("/api/events/filter/next").param("page-token", tampered))
            .andExpect(status().isForbidden());
    }

    @Test
    void readNextPage_missingToken_shouldReturnForbidden() throws Exception {
        mockMvc.perform(get("/api/events/filter/next"))
            .andExpect(status().isForbidden());
    }

    @Test
    void countEvents_byEvent_shouldGroupNames() throws Exception {
        Instant now = Instant.now();
        publish(List.of(event(prefix + "a", now), event(prefix + "a", now), event(prefix + "b", now)));

        mockMvc.perform(post("/api/events/count-by/event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"filter": {"event": {"prefix": ["%s"]}}}
                    """.formatted(prefix)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].value").value(prefix + "a"))
            .andExpect(jsonPath("$[0].count").value(2));
    }

    @Test
    void countEvents_intervalTooSmall_shouldReturnUnprocessable() throws Exception {
        mockMvc.perform(post("/api/events/count-by/time")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"time_unit": "hour", "time_interval": 0.001}
                    """))
            .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void countEvents_negativeIntervalForEventCountable_shouldReturnUnprocessable() throws Exception {
        mockMvc.perform(post("/api/events/count-by/event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"time_interval": -5}
                    """))
            .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void countEvents_unknownCountable_shouldReturnUnprocessable() throws Exception {
        mockMvc.perform(post("/api/events/count-by/colour")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isUnprocessableEntity());
    }

    // ========== Helper Methods ==========

    private List<String> names(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        List<String> names = new ArrayList<>();
        body.get("events").forEach(e -> names.add(e.get("event").asText()));
        return names;
    }

    private String nextPage(MvcResult result) throws Exception {
        JsonNode next = objectMapper.readTree(result.getResponse().getContentAsString()).get("next_page");
        return next == null || next.isNull() ? null : next.asText();
    }
}
