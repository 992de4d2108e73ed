package com.prospectpulse.backend.service;

import com.prospectpulse.backend.exception.NotFoundException;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Entry point for lead-processing jobs: enqueue, status reads and streaming.
 * Each job id is handed to exactly one worker.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStatusTracker jobStatusTracker;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final WorkspaceService workspaceService;
    private final TaskExecutor jobExecutor;

    public JobService(JobStatusTracker jobStatusTracker,
            PipelineOrchestrator pipelineOrchestrator,
            WorkspaceService workspaceService,
            @Qualifier("jobExecutor") TaskExecutor jobExecutor) {
        this.jobStatusTracker = jobStatusTracker;
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.workspaceService = workspaceService;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Record a queued job and hand it to a worker.
     *
     * @return the new job id
     * @throws IllegalArgumentException if {@code leads} is empty
     * @throws NotFoundException if {@code workspaceId} names no workspace
     */
    public String enqueue(List<Map<String, Object>> leads, String workspaceId) {
        if (leads == null || leads.isEmpty()) {
            throw new IllegalArgumentException("No leads provided");
        }
        if (workspaceId != null && !workspaceService.exists(workspaceId)) {
            throw new NotFoundException("Workspace", workspaceId);
        }

        String jobId = UUID.randomUUID().toString();
        jobStatusTracker.create(jobId, workspaceId);

        List<Map<String, Object>> batch = List.copyOf(leads);
        try {
            jobExecutor.execute(() -> execute(jobId, batch, workspaceId));
        } catch (TaskRejectedException e) {
            log.error("[JOB] Worker pool rejected job: {}", jobId);
            jobStatusTracker.fail(jobId, "Job rejected: worker pool saturated");
            throw e;
        }

        log.info("[JOB] Enqueued job: {} with {} leads", jobId, batch.size());
        return jobId;
    }

    public Job getStatus(String jobId) {
        return jobStatusTracker.get(jobId);
    }

    public Job stream(String jobId, Consumer<Job> sink) {
        return jobStatusTracker.stream(jobId, sink);
    }

    private void execute(String jobId, List<Map<String, Object>> leads, String workspaceId) {
        try {
            pipelineOrchestrator.run(jobId, leads, workspaceId);
        } catch (RuntimeException e) {
            // the orchestrator has already recorded the failure on the job
            log.warn("[JOB] Job {} ended in failure: {}", jobId, e.getMessage());
        }
    }
}
