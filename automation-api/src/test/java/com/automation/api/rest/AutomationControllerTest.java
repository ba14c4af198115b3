package com.automation.api.rest;

import com.automation.core.exception.AutomationValidationException;
import com.automation.core.exception.NotFoundException;
import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;
import com.automation.core.repository.ActionInvocationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AutomationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ActionInvocationRepository ledger;

    private static String automation(String name, String expect) {
        return """
            {
              "name": "%s",
              "trigger": {
                "match": {"prefect.resource.id": "test.resource.*"},
                "expect": ["%s"],
                "posture": "Reactive",
                "threshold": 1,
                "within": 0
              },
              "actions": [{"type": "do-nothing"}]
            }
            """.formatted(name, expect);
    }

    private UUID create(String body) throws Exception {
        String response = mockMvc.perform(post("/api/automations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return UUID.fromString(objectMapper.readTree(response).get("id").asText());
    }

    @Test
    void createAutomation_shouldReturnCreatedAndBeReadable() throws Exception {
        UUID id = create(automation("notify on failure", "test.failed"));

        mockMvc.perform(get("/api/automations/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("notify on failure"))
            .andExpect(jsonPath("$.enabled").value(true))
            .andExpect(jsonPath("$.actions[0].type").value("do-nothing"));

        mockMvc.perform(get("/api/automations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].id", hasItem(id.toString())));
    }

    @Test
    @DisplayName("Every authoring problem is reported in one response")
    void createAutomation_invalid_shouldListProblems() throws Exception {
        String invalid = """
            {
              "name": "",
              "trigger": {"expect": ["prefect.*.Failed"], "threshold": -1},
              "actions": []
            }
            """;

        mockMvc.perform(post("/api/automations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(invalid))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value(AutomationValidationException.ERROR_CODE))
            .andExpect(jsonPath("$.problems", hasItem("name: is required")))
            .andExpect(jsonPath("$.problems", hasItem("threshold: must not be negative")))
            .andExpect(jsonPath("$.problems", hasItem("actions: at least one action is required")));
    }

    @Test
    void getAutomation_unknown_shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/automations/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value(NotFoundException.ERROR_CODE));
    }

    @Test
    void getAutomation_malformedId_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(get("/api/automations/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void updateAutomation_shouldReplaceDefinition() throws Exception {
        UUID id = create(automation("before", "test.failed"));

        mockMvc.perform(put("/api/automations/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(automation("after", "test.crashed")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id.toString()))
            .andExpect(jsonPath("$.name").value("after"))
            .andExpect(jsonPath("$.trigger.expect[0]").value("test.crashed"));
    }

    @Test
    void patchAutomation_shouldToggleEnabled() throws Exception {
        UUID id = create(automation("toggle", "test.failed"));

        mockMvc.perform(patch("/api/automations/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"enabled\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.enabled").value(false));

        mockMvc.perform(get("/api/automations/{id}", id))
            .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void deleteAutomation_shouldRemoveIt() throws Exception {
        UUID id = create(automation("short lived", "test.failed"));

        mockMvc.perform(delete("/api/automations/{id}", id))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/automations/{id}", id))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/automations/{id}", id))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("An event published over REST fires a matching automation")
    void publishedEvent_shouldFireAutomation() throws Exception {
        String eventName = "test." + UUID.randomUUID() + ".failed";
        UUID id = create(automation("fires", eventName));

        mockMvc.perform(post("/api/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    [{"occurred": "%s", "event": "%s", "resource": {"prefect.resource.id": "test.resource.1"}}]
                    """.formatted(Instant.now(), eventName)))
            .andExpect(status().isNoContent());

        List<ActionInvocation> invocations = awaitInvocations(id);
        assertThat(invocations).extracting(ActionInvocation::state).containsExactly(ActionState.SUCCEEDED);
    }

    // ========== Helper Methods ==========

    private List<ActionInvocation> awaitInvocations(UUID automationId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        List<ActionInvocation> invocations = ledger.findByAutomation(automationId);
        while (System.currentTimeMillis() < deadline
                && (invocations.isEmpty() || invocations.stream().anyMatch(i -> !i.state().isTerminal()))) {
            Thread.sleep(50);
            invocations = ledger.findByAutomation(automationId);
        }
        return invocations;
    }
}
