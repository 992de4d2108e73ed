package com.prospectpulse.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error response")
public record ErrorResponse(
        @Schema(description = "Machine-readable error code", example = "NOT_FOUND") String error,
        @Schema(description = "Human-readable detail") String message) {
}
