package com.prospectpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prospectpulse.backend.model.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recorded workspace operation")
public class OperationResponse {

    @JsonProperty("operation_id")
    private String operationId;

    @JsonProperty("operation_type")
    private String kind;

    @JsonProperty("workspace_id")
    private String targetId;

    @Schema(description = "JSON payload with credentials masked")
    private String data;

    private String status;

    private String error;

    private Instant timestamp;

    public static OperationResponse from(Operation operation) {
        return OperationResponse.builder()
                .operationId(operation.getOperationId())
                .kind(operation.getKind() != null ? operation.getKind().value() : null)
                .targetId(operation.getTargetId())
                .data(operation.getPayload())
                .status(operation.getStatus() != null ? operation.getStatus().value() : null)
                .error(operation.getError())
                .timestamp(operation.getCreatedAt())
                .build();
    }
}
