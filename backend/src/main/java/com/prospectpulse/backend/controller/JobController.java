package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.dto.JobStatusResponse;
import com.prospectpulse.backend.exception.ProspectPulseException;
import com.prospectpulse.backend.service.JobService;
import com.prospectpulse.backend.service.LeadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Lead processing jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobService jobService;
    private final LeadService leadService;
    private final TaskExecutor streamExecutor;
    private final Duration streamTimeout;

    public JobController(JobService jobService,
            LeadService leadService,
            @Qualifier("streamExecutor") TaskExecutor streamExecutor,
            @Value("${prospectpulse.jobs.stream-timeout:60s}") Duration streamTimeout) {
        this.jobService = jobService;
        this.leadService = leadService;
        this.streamExecutor = streamExecutor;
        this.streamTimeout = streamTimeout;
    }

    @PostMapping("/enqueue")
    @Operation(summary = "Enqueue leads", description = "Queue a batch of leads for mining, validation and synthesis")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job queued"),
            @ApiResponse(responseCode = "400", description = "No leads provided"),
            @ApiResponse(responseCode = "404", description = "Workspace not found")
    })
    public ResponseEntity<?> enqueue(
            @RequestBody List<Map<String, Object>> leads,
            @Parameter(description = "Workspace ID") @RequestParam(name = "workspace_id", required = false) String workspaceId) {
        try {
            String jobId = jobService.enqueue(leads, workspaceId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("job_id", jobId));
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage());
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        } catch (RuntimeException e) {
            log.error("Failed to enqueue job", e);
            return ApiErrors.internal(e.getMessage());
        }
    }

    @GetMapping("/{id}/status")
    @Operation(summary = "Get job status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job found"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<?> getStatus(@Parameter(description = "Job ID") @PathVariable String id) {
        try {
            return ResponseEntity.ok(JobStatusResponse.from(jobService.getStatus(id)));
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/{id}/leads")
    @Operation(summary = "Leads written by a job")
    public ResponseEntity<?> getJobLeads(@Parameter(description = "Job ID") @PathVariable String id) {
        try {
            jobService.getStatus(id);
            return ResponseEntity.ok(Map.of("items", leadService.listByJob(id)));
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream job status", description = "Server-sent events: the current status, then every change until the job completes or fails")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event stream opened"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<SseEmitter> stream(@Parameter(description = "Job ID") @PathVariable String id) {
        try {
            jobService.getStatus(id);
        } catch (ProspectPulseException e) {
            return ResponseEntity.status(ApiErrors.statusOf(e)).build();
        }

        SseEmitter emitter = new SseEmitter(streamTimeout.plusSeconds(5).toMillis());
        try {
            streamExecutor.execute(() -> {
                try {
                    jobService.stream(id, job -> {
                        try {
                            emitter.send(SseEmitter.event().name("message").data(JobStatusResponse.from(job)));
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
                    emitter.complete();
                } catch (UncheckedIOException e) {
                    log.debug("[STREAM] Client left stream for job: {}", id);
                    emitter.completeWithError(e.getCause());
                } catch (RuntimeException e) {
                    log.warn("[STREAM] Stream for job {} aborted: {}", id, e.getMessage());
                    emitter.completeWithError(e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[STREAM] Too many open streams, refusing job: {}", id);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(emitter);
    }
}
