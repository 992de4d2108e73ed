package com.prospectpulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one state-changing call against a workspace. Expires on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Operation {

    private String operationId;

    private OperationKind kind;

    private String targetId;

    // JSON
    private String payload;

    @Builder.Default
    private OperationStatus status = OperationStatus.PENDING;

    private String error;

    private Instant createdAt;
}
