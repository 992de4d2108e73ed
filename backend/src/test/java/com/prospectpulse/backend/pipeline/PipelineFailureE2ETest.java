package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.BaseE2ETest;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.service.JobService;
import com.prospectpulse.backend.service.LeadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class PipelineFailureE2ETest extends BaseE2ETest {

    @Autowired
    private JobService jobService;

    @Autowired
    private LeadService leadService;

    @MockBean
    private Synthesizer synthesizer;

    @Test
    void shouldFailJobAndWriteNoLeads() {
        // Given
        when(synthesizer.synthesize(any(), any(), any())).thenThrow(new IllegalStateException("model quota exceeded"));

        // When
        String jobId = jobService.enqueue(List.of(Map.of("company", "Acme Corp"), Map.of("company", "Beta LLC")), null);

        // Then
        await().atMost(Duration.ofSeconds(10))
                .until(() -> jobService.getStatus(jobId).getStatus().isTerminal());
        Job job = jobService.getStatus(jobId);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(0.7, job.getProgress());
        assertNotNull(job.getError());
        assertTrue(job.getError().contains("model quota exceeded"));
        assertTrue(leadService.listByJob(jobId).isEmpty());
        assertEquals(0, leadService.list(1, 50).total());
    }
}
