package com.phiguard.interfaces.api;

import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.interfaces.api.exception.GlobalExceptionHandler;
import com.phiguard.support.RotationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RotationControllerTest {

    private RotationFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixture = new RotationFixture();
        PhiGuardProperties properties = new PhiGuardProperties();
        properties.getRotation().setBatchSize(2);

        mockMvc = MockMvcBuilders
            .standaloneSetup(
                new RotationController(fixture.orchestrator, properties),
                new KeyController(fixture.keyManagement))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void start_returns_created_job() throws Exception {
        fixture.seedClients(3);

        mockMvc.perform(post("/api/v1/rotations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newVersion\":\"v2\",\"requestedBy\":\"ops\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.sourceVersion").value("v1"))
            .andExpect(jsonPath("$.targetVersion").value("v2"))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.totalRows").value(3));
    }

    @Test
    void start_validates_request() throws Exception {
        mockMvc.perform(post("/api/v1/rotations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newVersion\":\"two\",\"requestedBy\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.validationErrors", hasSize(2)));
    }

    @Test
    void second_start_conflicts() throws Exception {
        fixture.orchestrator.start("v2", false, "ops");

        mockMvc.perform(post("/api/v1/rotations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"newVersion\":\"v3\",\"requestedBy\":\"ops\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void step_uses_configured_batch_size() throws Exception {
        fixture.seedClients(3);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");

        mockMvc.perform(post("/api/v1/rotations/{id}/step", job.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andExpect(jsonPath("$.scanned").value(2))
            .andExpect(jsonPath("$.cursor").value(2))
            .andExpect(jsonPath("$.exhausted").value(false));
    }

    @Test
    void complete_before_full_scan_conflicts() throws Exception {
        fixture.seedClients(3);
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");
        fixture.orchestrator.step(job.getId(), 2);

        mockMvc.perform(post("/api/v1/rotations/{id}/complete", job.getId()))
            .andExpect(status().isConflict());
    }

    @Test
    void rollback_and_status() throws Exception {
        RotationJob job = fixture.orchestrator.start("v2", false, "ops");

        mockMvc.perform(post("/api/v1/rotations/{id}/rollback", job.getId()).param("reason", "drill"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ROLLED_BACK"))
            .andExpect(jsonPath("$.lastError").value("drill"));

        mockMvc.perform(get("/api/v1/rotations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void unknown_job_is_not_found() throws Exception {
        mockMvc.perform(get("/api/v1/rotations/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void keys_are_listed_and_retirement_of_a_needed_key_conflicts() throws Exception {
        fixture.orchestrator.start("v2", false, "ops");

        mockMvc.perform(get("/api/v1/keys"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].label").value("v1"))
            .andExpect(jsonPath("$[1].role").value("WRITE_CURRENT"));

        mockMvc.perform(post("/api/v1/keys/{label}/retire", "v1"))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/keys/{label}/retire", "v7"))
            .andExpect(status().isNotFound());
    }
}
