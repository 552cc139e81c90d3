package com.suraksha.safetymonitor.integration;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests through the HTTP layer against the in-memory H2 store.
 *
 * Each test reports as its own user so monitor state never leaks between tests.
 *
 * Test cases:
 *  1. speed 40 m/s → anomaly and a high incident in the response and the incident list
 *  1a. replaying an earlier event id raises no second incident
 *  2. admin creates a safe zone; a report at its center is inside it
 *  3. panic with lat 91 → 400 VALIDATION_ERROR; a valid panic → 201 {status:"ok", alert}
 *  4. ack then resolve → resolved, updatedAt after createdAt; ack after resolve → 409
 *  5. missing identity → 401, wrong role → 403, unknown incident → 404
 */
@SpringBootTest
@AutoConfigureMockMvc
class SafetyMonitorIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private static final String USER_ID = "X-User-Id";
    private static final String ROLE = "X-User-Role";

    private long reportAnomaly(String userId) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/location")
                        .header(USER_ID, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":28.7,\"longitude\":77.3,\"speed\":40,\"accuracy\":10}"))
                .andExpect(status().isOk())
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.incident.id")).longValue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Location reports
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("speed 40 m/s → unrealistic_speed and a high anomaly incident")
    void unrealisticSpeed_createsHighIncident() throws Exception {
        mockMvc.perform(post("/api/location")
                        .header(USER_ID, "it-speeder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":28.7,\"longitude\":77.3,\"speed\":40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.saved").value(true))
                .andExpect(jsonPath("$.anomaly").value("unrealistic_speed"))
                .andExpect(jsonPath("$.geofences").isEmpty())
                .andExpect(jsonPath("$.incident.type").value("anomaly"))
                .andExpect(jsonPath("$.incident.severity").value("high"))
                .andExpect(jsonPath("$.incident.status").value("open"))
                .andExpect(jsonPath("$.incident.userId").value("it-speeder"));

        mockMvc.perform(get("/api/incidents")
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer")
                        .param("severity", "high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].userId", hasItem("it-speeder")));
    }

    @Test
    @DisplayName("Replaying an earlier event id after a newer one raises no second incident")
    void replayedEvent_noSecondIncident() throws Exception {
        String first = "{\"eventId\":\"it-replay-e1\",\"latitude\":28.7,\"longitude\":77.3,\"speed\":40}";
        String second = "{\"eventId\":\"it-replay-e2\",\"latitude\":28.7,\"longitude\":77.3,\"speed\":40}";

        mockMvc.perform(post("/api/location").header(USER_ID, "it-replay")
                        .contentType(MediaType.APPLICATION_JSON).content(first))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.incident.id").exists());
        mockMvc.perform(post("/api/location").header(USER_ID, "it-replay")
                        .contentType(MediaType.APPLICATION_JSON).content(second))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.incident.id").exists());
        mockMvc.perform(post("/api/location").header(USER_ID, "it-replay")
                        .contentType(MediaType.APPLICATION_JSON).content(first))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.saved").value(true))
                .andExpect(jsonPath("$.incident").doesNotExist());

        mockMvc.perform(get("/api/incidents")
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.userId == 'it-replay')]", hasSize(2)));
    }

    @Test
    @DisplayName("A report at the center of a new safe zone is inside it")
    void reportInsideNewSafeZone() throws Exception {
        mockMvc.perform(post("/api/safe-zones")
                        .header(USER_ID, "admin-1")
                        .header(ROLE, "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Z\",\"latitude\":28.6,\"longitude\":77.2,"
                                + "\"radiusMeters\":500,\"alertThresholdSeconds\":30}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").isNumber());

        mockMvc.perform(post("/api/location")
                        .header(USER_ID, "it-inside")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":28.6,\"longitude\":77.2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomaly").doesNotExist())
                .andExpect(jsonPath("$.incident").doesNotExist())
                .andExpect(jsonPath("$.safeZones[*].name", hasItem("Z")))
                .andExpect(jsonPath("$.safetyStatus.isInSafeZone").value(true));

        mockMvc.perform(get("/api/safety-status/it-inside").header(USER_ID, "it-inside"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("it-inside"));
    }

    @Test
    @DisplayName("A user may not create safe zones")
    void createSafeZone_userForbidden() throws Exception {
        mockMvc.perform(post("/api/safe-zones")
                        .header(USER_ID, "it-user")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mine\",\"latitude\":1.0,\"longitude\":1.0,\"radiusMeters\":100}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("Out-of-range latitude on a location report → 400 VALIDATION_ERROR")
    void locationLatitudeOutOfRange() throws Exception {
        mockMvc.perform(post("/api/location")
                        .header(USER_ID, "it-bad")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":91,\"longitude\":77.2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Panic
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Panic with lat 91 → 400 VALIDATION_ERROR")
    void panicLatitudeOutOfRange() throws Exception {
        mockMvc.perform(post("/api/panic")
                        .header(USER_ID, "it-panic-bad")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lat\":91,\"lng\":77.2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message", containsString("lat")));
    }

    @Test
    @DisplayName("Valid panic → 201 {status:ok, alert}; an officer acknowledges it once")
    void panic_createdThenAcknowledged() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/panic")
                        .header(USER_ID, "it-panic")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lat\":28.61,\"lng\":77.21}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.alert.userId").value("it-panic"))
                .andExpect(jsonPath("$.alert.acknowledged").value(false))
                .andReturn();
        long id = ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.alert.id")).longValue();

        mockMvc.perform(post("/api/panic-alerts/{id}/ack", id)
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value(true))
                .andExpect(jsonPath("$.acknowledgedBy").value("officer-1"));

        mockMvc.perform(post("/api/panic-alerts/{id}/ack", id)
                        .header(USER_ID, "officer-2")
                        .header(ROLE, "officer"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Incident lifecycle
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("ack then resolve → resolved with updatedAt after createdAt; ack after resolve → 409")
    void incidentLifecycle() throws Exception {
        long id = reportAnomaly("it-lifecycle");

        mockMvc.perform(post("/api/incidents/{id}/ack", id)
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("acknowledged"))
                .andExpect(jsonPath("$.acknowledgedBy").value("officer-1"));

        MvcResult resolved = mockMvc.perform(post("/api/incidents/{id}/resolve", id)
                        .header(USER_ID, "admin-1")
                        .header(ROLE, "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"))
                .andReturn();

        String body = resolved.getResponse().getContentAsString();
        Instant createdAt = Instant.parse(JsonPath.read(body, "$.createdAt"));
        Instant updatedAt = Instant.parse(JsonPath.read(body, "$.updatedAt"));
        assertThat(updatedAt).isAfter(createdAt);

        mockMvc.perform(post("/api/incidents/{id}/ack", id)
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("A plain user may not acknowledge an incident")
    void acknowledge_userForbidden() throws Exception {
        long id = reportAnomaly("it-forbidden");

        mockMvc.perform(post("/api/incidents/{id}/ack", id).header(USER_ID, "it-forbidden"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Auth and errors
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("No identity → 401 UNAUTHENTICATED")
    void missingIdentity_unauthenticated() throws Exception {
        mockMvc.perform(get("/api/incidents"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    @DisplayName("An unknown role → 401 UNAUTHENTICATED")
    void unknownRole_unauthenticated() throws Exception {
        mockMvc.perform(get("/api/incidents").header(USER_ID, "x").header(ROLE, "superuser"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Unknown incident → 404 NOT_FOUND")
    void unknownIncident_notFound() throws Exception {
        mockMvc.perform(get("/api/incidents/{id}", 987654321L)
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Unknown status filter → 400 VALIDATION_ERROR")
    void unknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/incidents").param("status", "closed")
                        .header(USER_ID, "officer-1")
                        .header(ROLE, "officer"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Health needs no identity")
    void health_public() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
