package com.prospectpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prospectpulse.backend.model.Workspace;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Workspace details response")
public class WorkspaceResponse {

    @Schema(description = "Workspace ID")
    private String id;

    @Schema(description = "LLM provider")
    private String provider;

    @JsonProperty("openai_key")
    private String openaiKey;

    @JsonProperty("gemini_key")
    private String geminiKey;

    @JsonProperty("tavily_key")
    private String tavilyKey;

    public static WorkspaceResponse from(Workspace workspace) {
        return WorkspaceResponse.builder()
                .id(workspace.getId())
                .provider(workspace.getProvider().value())
                .openaiKey(workspace.getOpenaiKey())
                .geminiKey(workspace.getGeminiKey())
                .tavilyKey(workspace.getTavilyKey())
                .build();
    }
}
