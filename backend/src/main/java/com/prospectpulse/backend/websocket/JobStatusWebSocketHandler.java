package com.prospectpulse.backend.websocket;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.dto.JobStatusResponse;
import com.prospectpulse.backend.exception.NotFoundException;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Streams status snapshots of one job to a WebSocket client, then closes the
 * connection once the job is complete or failed or the stream budget runs out.
 * Path format: /ws/jobs/{jobId}
 */
@Component
public class JobStatusWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(JobStatusWebSocketHandler.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final JobService jobService;
    private final TaskExecutor streamExecutor;

    public JobStatusWebSocketHandler(ObjectMapper objectMapper,
            JobService jobService,
            @Qualifier("streamExecutor") TaskExecutor streamExecutor) {
        this.objectMapper = objectMapper;
        this.jobService = jobService;
        this.streamExecutor = streamExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String jobId = extractJobId(session);
        if (jobId == null) {
            close(session, CloseStatus.BAD_DATA.withReason("missing job id"));
            return;
        }
        log.info("WebSocket connected for job: {} session: {}", jobId, session.getId());

        try {
            streamExecutor.execute(() -> streamTo(session, jobId));
        } catch (TaskRejectedException e) {
            log.warn("Too many open streams, closing session: {}", session.getId());
            close(session, CloseStatus.SERVICE_OVERLOAD);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket disconnected for job: {} session: {}", extractJobId(session), session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring client message on job stream: {}", message.getPayload());
    }

    private void streamTo(WebSocketSession session, String jobId) {
        try {
            jobService.stream(jobId, job -> send(session, job));
            close(session, CloseStatus.NORMAL);
        } catch (NotFoundException e) {
            close(session, CloseStatus.POLICY_VIOLATION.withReason("job not found"));
        } catch (UncheckedIOException e) {
            log.debug("Client left stream for job: {} session: {}", jobId, session.getId());
        } catch (RuntimeException e) {
            log.error("Job stream failed for job: {}", jobId, e);
            close(session, CloseStatus.SERVER_ERROR);
        }
    }

    private void send(WebSocketSession session, Job job) {
        if (!session.isOpen()) {
            throw new UncheckedIOException(new IOException("session closed"));
        }
        try {
            WebSocketMessage message = WebSocketMessage.builder()
                    .type("JOB_STATUS")
                    .jobId(job.getJobId())
                    .data(objectMapper.convertValue(JobStatusResponse.from(job), MAP_TYPE))
                    .build();
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void close(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("Failed to close WebSocket session: {}", session.getId(), e);
        }
    }

    private String extractJobId(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        String[] parts = session.getUri().getPath().split("/");
        if (parts.length >= 4 && "ws".equals(parts[1]) && "jobs".equals(parts[2]) && !parts[3].isBlank()) {
            return parts[3];
        }
        return null;
    }
}
