package com.prospectpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider credentials supplied with a workspace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Provider credentials")
public class WorkspaceKeys {

    @Schema(description = "Provider override (optional, defaults to the top-level provider)", example = "openai")
    private String provider;

    @JsonProperty("openai_key")
    @Schema(description = "OpenAI API key")
    private String openaiKey;

    @JsonProperty("gemini_key")
    @Schema(description = "Gemini API key")
    private String geminiKey;

    @JsonProperty("tavily_key")
    @Schema(description = "Tavily search API key")
    private String tavilyKey;
}
