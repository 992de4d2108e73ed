package com.prospectpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prospectpulse.backend.model.Job;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Job status response")
public class JobStatusResponse {

    @JsonProperty("job_id")
    @Schema(description = "Job ID")
    private String jobId;

    @JsonProperty("workspace_id")
    @Schema(description = "Workspace the job runs for, if any")
    private String workspaceId;

    @Schema(description = "Current status", example = "mining")
    private String status;

    @Schema(description = "Progress between 0 and 1")
    private double progress;

    @Schema(description = "Error message if failed")
    private String error;

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .workspaceId(job.getWorkspaceId())
                .status(job.getStatus().value())
                .progress(job.getProgress())
                .error(job.getError())
                .build();
    }
}
