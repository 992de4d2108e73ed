package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.dto.WorkspaceKeys;
import com.prospectpulse.backend.dto.WorkspaceRequest;
import com.prospectpulse.backend.dto.WorkspaceResponse;
import com.prospectpulse.backend.exception.ProspectPulseException;
import com.prospectpulse.backend.model.Workspace;
import com.prospectpulse.backend.model.WorkspaceProvider;
import com.prospectpulse.backend.service.WorkspaceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workspaces")
@Tag(name = "Workspaces", description = "Tenant configuration management")
public class WorkspaceController {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceController.class);

    private final WorkspaceService workspaceService;

    public WorkspaceController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @PostMapping
    @Operation(summary = "Create workspace", description = "Create a workspace; repeating the call with the same id returns the stored workspace")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Workspace created or already present"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "409", description = "Workspace is locked by another writer")
    })
    public ResponseEntity<?> createWorkspace(@Valid @RequestBody WorkspaceRequest request) {
        try {
            Workspace workspace = workspaceService.create(request.getWorkspaceId(), toWorkspace(request));
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("workspace_id", workspace.getId()));
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage());
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        } catch (RuntimeException e) {
            log.error("Failed to create workspace", e);
            return ApiErrors.internal(e.getMessage());
        }
    }

    @GetMapping
    @Operation(summary = "List workspaces", description = "All workspaces currently stored")
    public ResponseEntity<?> listWorkspaces() {
        try {
            List<WorkspaceResponse> items = workspaceService.list().stream()
                    .map(WorkspaceResponse::from)
                    .toList();
            return ResponseEntity.ok(Map.of("items", items));
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get workspace")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Workspace found"),
            @ApiResponse(responseCode = "404", description = "Workspace not found")
    })
    public ResponseEntity<?> getWorkspace(@Parameter(description = "Workspace ID") @PathVariable String id) {
        try {
            return ResponseEntity.ok(WorkspaceResponse.from(workspaceService.get(id)));
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace workspace", description = "Replace the full configuration of an existing workspace")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Workspace replaced"),
            @ApiResponse(responseCode = "404", description = "Workspace not found")
    })
    public ResponseEntity<?> updateWorkspace(
            @Parameter(description = "Workspace ID") @PathVariable String id,
            @Valid @RequestBody WorkspaceRequest request) {
        try {
            return ResponseEntity.ok(WorkspaceResponse.from(workspaceService.update(id, toWorkspace(request))));
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage());
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        } catch (RuntimeException e) {
            log.error("Failed to update workspace {}", id, e);
            return ApiErrors.internal(e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete workspace")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Workspace deleted"),
            @ApiResponse(responseCode = "404", description = "Workspace not found")
    })
    public ResponseEntity<?> deleteWorkspace(@Parameter(description = "Workspace ID") @PathVariable String id) {
        try {
            workspaceService.delete(id);
            return ResponseEntity.ok(Map.of("message", "Workspace " + id + " deleted successfully"));
        } catch (ProspectPulseException e) {
            log.debug("Delete of workspace {} refused: {}", id, e.getMessage());
            return ApiErrors.of(e);
        } catch (RuntimeException e) {
            log.error("Failed to delete workspace {}", id, e);
            return ApiErrors.internal(e.getMessage());
        }
    }

    private Workspace toWorkspace(WorkspaceRequest request) {
        WorkspaceKeys keys = request.getKeys() != null ? request.getKeys() : new WorkspaceKeys();
        String provider = keys.getProvider() != null && !keys.getProvider().isBlank()
                ? keys.getProvider()
                : request.getProvider();
        return Workspace.builder()
                .provider(WorkspaceProvider.fromValue(provider))
                .openaiKey(keys.getOpenaiKey() != null ? keys.getOpenaiKey() : "")
                .geminiKey(keys.getGeminiKey() != null ? keys.getGeminiKey() : "")
                .tavilyKey(keys.getTavilyKey() != null ? keys.getTavilyKey() : "")
                .build();
    }
}
