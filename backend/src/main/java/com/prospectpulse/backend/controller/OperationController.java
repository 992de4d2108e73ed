package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.dto.OperationResponse;
import com.prospectpulse.backend.exception.ProspectPulseException;
import com.prospectpulse.backend.service.OperationLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the operation log for diagnosis. Records disappear once they expire.
 */
@RestController
@RequestMapping("/api/operations")
@Tag(name = "Operations", description = "Recent workspace operations")
public class OperationController {

    private final OperationLogService operationLog;

    public OperationController(OperationLogService operationLog) {
        this.operationLog = operationLog;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get operation", description = "Status of a recent workspace operation")
    public ResponseEntity<?> getOperation(@PathVariable String id) {
        try {
            return operationLog.find(id)
                    .<ResponseEntity<?>>map(operation -> ResponseEntity.ok(OperationResponse.from(operation)))
                    .orElse(ResponseEntity.notFound().build());
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }
}
