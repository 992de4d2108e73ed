package com.prospectpulse.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.BaseE2ETest;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.service.JobStatusTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class JobStatusWebSocketHandlerE2ETest extends BaseE2ETest {

    @LocalServerPort
    private int port;

    @Autowired
    private JobStatusTracker jobStatusTracker;

    @Autowired
    private ObjectMapper objectMapper;

    private static class RecordingHandler extends TextWebSocketHandler {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final AtomicReference<CloseStatus> closed = new AtomicReference<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            messages.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.set(status);
        }
    }

    private RecordingHandler connect(String jobId) throws Exception {
        RecordingHandler handler = new RecordingHandler();
        new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + port + "/ws/jobs/" + jobId)
                .get(5, TimeUnit.SECONDS);
        return handler;
    }

    @Test
    void shouldStreamUntilJobCompletes() throws Exception {
        jobStatusTracker.create("job-ws", null);
        RecordingHandler handler = connect("job-ws");
        await().atMost(Duration.ofSeconds(5)).until(() -> !handler.messages.isEmpty());

        jobStatusTracker.update("job-ws", JobStatus.MINING, 0.1);
        jobStatusTracker.update("job-ws", JobStatus.COMPLETE, 1.0);

        await().atMost(Duration.ofSeconds(5)).until(() -> handler.closed.get() != null);
        assertEquals(CloseStatus.NORMAL.getCode(), handler.closed.get().getCode());

        WebSocketMessage first = objectMapper.readValue(handler.messages.get(0), WebSocketMessage.class);
        WebSocketMessage last = objectMapper.readValue(
                handler.messages.get(handler.messages.size() - 1), WebSocketMessage.class);
        assertEquals("JOB_STATUS", first.getType());
        assertEquals("job-ws", first.getJobId());
        assertEquals("queued", first.getData().get("status"));
        assertEquals("complete", last.getData().get("status"));
    }

    @Test
    void shouldCloseForUnknownJob() throws Exception {
        RecordingHandler handler = connect("missing");

        await().atMost(Duration.ofSeconds(5)).until(() -> handler.closed.get() != null);
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), handler.closed.get().getCode());
        assertTrue(handler.messages.isEmpty());
    }
}
