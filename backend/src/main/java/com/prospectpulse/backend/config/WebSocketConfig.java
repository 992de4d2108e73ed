package com.prospectpulse.backend.config;

import com.prospectpulse.backend.websocket.JobStatusWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final JobStatusWebSocketHandler jobStatusWebSocketHandler;

    @Value("${frontend.url:http://localhost:8501}")
    private String frontendUrl;

    public WebSocketConfig(JobStatusWebSocketHandler jobStatusWebSocketHandler) {
        this.jobStatusWebSocketHandler = jobStatusWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(jobStatusWebSocketHandler, "/ws/jobs/{jobId}")
                .setAllowedOrigins(frontendUrl);
    }
}
