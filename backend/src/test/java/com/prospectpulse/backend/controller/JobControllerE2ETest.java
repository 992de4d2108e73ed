package com.prospectpulse.backend.controller;

import com.jayway.jsonpath.JsonPath;
import com.prospectpulse.backend.BaseE2ETest;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.service.JobStatusTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class JobControllerE2ETest extends BaseE2ETest {

    private static final String TWO_LEADS = "[{\"company\":\"Acme Corp\"},{\"company\":\"Beta LLC\"}]";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JobStatusTracker jobStatusTracker;

    private String enqueue(String leads) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/jobs/enqueue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(leads))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").exists())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.job_id");
    }

    @Test
    void shouldEnqueueAndCompleteJob() throws Exception {
        String jobId = enqueue(TWO_LEADS);

        await().atMost(Duration.ofSeconds(10))
                .until(() -> jobStatusTracker.get(jobId).getStatus() == JobStatus.COMPLETE);

        mockMvc.perform(get("/api/jobs/{id}/status", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(jobId))
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.progress").value(1.0));

        mockMvc.perform(get("/api/jobs/{id}/leads", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(2)));

        mockMvc.perform(get("/api/leads").param("page", "1").param("size", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.total").value(2));
    }

    @Test
    void shouldRejectEmptyBatch() throws Exception {
        mockMvc.perform(post("/api/jobs/enqueue").contentType(MediaType.APPLICATION_JSON).content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No leads provided"));
    }

    @Test
    void shouldRejectUnknownWorkspace() throws Exception {
        mockMvc.perform(post("/api/jobs/enqueue")
                        .param("workspace_id", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TWO_LEADS))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() throws Exception {
        mockMvc.perform(get("/api/jobs/{id}/status", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        mockMvc.perform(get("/api/jobs/{id}/stream", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectInvalidPaging() throws Exception {
        mockMvc.perform(get("/api/leads").param("page", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldStreamStatusEventsUntilTerminal() throws Exception {
        jobStatusTracker.create("job-sse", null);
        jobStatusTracker.update("job-sse", JobStatus.MINING, 0.1);
        jobStatusTracker.fail("job-sse", "miner exploded");

        MvcResult result = mockMvc.perform(get("/api/jobs/{id}/stream", "job-sse"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(Duration.ofSeconds(10).toMillis());

        String events = result.getResponse().getContentAsString();
        assertTrue(events.contains("event:message"));
        assertTrue(events.contains("\"status\":\"failed\""));
        assertTrue(events.contains("miner exploded"));
    }

    @Test
    void shouldExposeRecordedOperation() throws Exception {
        mockMvc.perform(post("/api/workspaces")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workspace_id\":\"acme\",\"provider\":\"openai\",\"keys\":{\"openai_key\":\"sk-1\"}}"));
        String key = storeClient.getSession().scan("operations:*").iterator().next();
        String operationId = key.substring("operations:".length());

        mockMvc.perform(get("/api/operations/{id}", operationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation_type").value("create"))
                .andExpect(jsonPath("$.workspace_id").value("acme"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(content().string(not(containsString("sk-1"))));

        mockMvc.perform(get("/api/operations/{id}", "unknown-op"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReportDegradedHealthOnFallbackStore() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.service").value("prospectpulse-backend"))
                .andExpect(jsonPath("$.store.backend").value("in-memory"))
                .andExpect(content().string(containsString("development")));
    }

    @Test
    void shouldServeApiDocs() throws Exception {
        mockMvc.perform(get("/api-docs"))
                .andExpect(status().isOk());
    }
}
