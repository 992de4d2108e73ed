package com.prospectpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to create or replace a workspace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Workspace configuration")
public class WorkspaceRequest {

    @JsonProperty("workspace_id")
    @Schema(description = "Caller-chosen id; a UUID is generated when absent", example = "acme-sales")
    private String workspaceId;

    @NotBlank
    @Schema(description = "LLM provider", example = "openai", allowableValues = {"openai", "gemini"})
    private String provider;

    @Valid
    @Schema(description = "Provider credentials")
    private WorkspaceKeys keys;
}
