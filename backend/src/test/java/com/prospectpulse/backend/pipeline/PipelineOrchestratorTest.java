package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.exception.StageFailedException;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.model.Lead;
import com.prospectpulse.backend.service.JobStatusTracker;
import com.prospectpulse.backend.service.LeadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PipelineOrchestratorTest {

    private JobStatusTracker tracker;
    private LeadService leadService;
    private Miner miner;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        tracker = mock(JobStatusTracker.class);
        leadService = mock(LeadService.class);
        when(leadService.save(any(Lead.class))).thenAnswer(invocation -> invocation.getArgument(0));
        miner = spy(new DefaultMiner());
        orchestrator = new PipelineOrchestrator(miner, new DefaultValidator(), new DefaultSynthesizer(),
                tracker, leadService);
    }

    @Test
    void shouldAdvanceOncePerStage() {
        List<Lead> leads = orchestrator.run("job-1",
                List.of(Map.of("company", "Acme Corp"), Map.of("company", "Beta LLC")), "ws-1");

        assertEquals(2, leads.size());
        InOrder order = inOrder(tracker, leadService);
        order.verify(tracker).update("job-1", JobStatus.MINING, PipelineOrchestrator.MINING_PROGRESS);
        order.verify(tracker).update("job-1", JobStatus.VALIDATING, PipelineOrchestrator.VALIDATING_PROGRESS);
        order.verify(tracker).update("job-1", JobStatus.SYNTHESIZING, PipelineOrchestrator.SYNTHESIZING_PROGRESS);
        order.verify(leadService, times(2)).save(any(Lead.class));
        order.verify(tracker).update("job-1", JobStatus.COMPLETE, PipelineOrchestrator.COMPLETE_PROGRESS);
        verify(tracker, never()).fail(anyString(), anyString());
    }

    @Test
    void shouldBuildLeadFromStageOutputs() {
        Lead lead = orchestrator.processLead("job-1", Map.of("id", "lead-7", "company", "Acme Corp"), "ws-1");

        assertEquals("lead-7", lead.getId());
        assertEquals("job-1", lead.getJobId());
        assertEquals("ws-1", lead.getWorkspaceId());
        assertEquals("Acme Corp", lead.getCompany());
        assertEquals(85, lead.getFitScore());
        assertEquals(2, lead.getSignals().size());
    }

    @Test
    void shouldFallBackToUnknownCompany() {
        Lead lead = orchestrator.processLead("job-1", Map.of(), null);

        assertEquals("Unknown Co", lead.getCompany());
    }

    @Test
    void shouldFailJobWhenStageThrows() {
        doThrow(new IllegalStateException("forum search timed out")).when(miner).mine(anyMap());

        StageFailedException e = assertThrows(StageFailedException.class,
                () -> orchestrator.run("job-1", List.of(Map.of("company", "Acme Corp")), null));

        assertEquals("mine", e.getStage());
        verify(tracker).fail(eq("job-1"), contains("forum search timed out"));
        verify(tracker, never()).update(eq("job-1"), eq(JobStatus.VALIDATING), anyDouble());
        verifyNoInteractions(leadService);
    }

    @Test
    void shouldFailWhenStageReturnsNothing() {
        doReturn(null).when(miner).mine(anyMap());

        assertThrows(StageFailedException.class,
                () -> orchestrator.run("job-1", List.of(Map.of("company", "Acme Corp")), null));
        verify(tracker).fail(eq("job-1"), anyString());
    }

    @Test
    void shouldRemovePartiallyWrittenLeads() {
        when(leadService.save(any(Lead.class)))
                .thenAnswer(invocation -> invocation.getArgument(0))
                .thenThrow(new IllegalStateException("store write failed"));

        assertThrows(IllegalStateException.class, () -> orchestrator.run("job-1",
                List.of(Map.of("id", "a", "company", "Acme Corp"), Map.of("id", "b", "company", "Beta LLC")), null));

        verify(leadService).delete(argThat(lead -> "a".equals(lead.getId()) && "job-1".equals(lead.getJobId())));
        verify(leadService, never()).delete(argThat(lead -> "b".equals(lead.getId())));
        verify(tracker).fail("job-1", "store write failed");
        verify(tracker, never()).update("job-1", JobStatus.COMPLETE, PipelineOrchestrator.COMPLETE_PROGRESS);
    }

    @Test
    void shouldRethrowOriginalErrorWhenMarkingFailedAlsoFails() {
        doThrow(new IllegalStateException("boom")).when(miner).mine(anyMap());
        when(tracker.fail(anyString(), anyString())).thenThrow(new IllegalStateException("store down"));

        StageFailedException e = assertThrows(StageFailedException.class,
                () -> orchestrator.run("job-1", List.of(Map.of("company", "Acme Corp")), null));

        assertEquals(1, e.getSuppressed().length);
    }
}
