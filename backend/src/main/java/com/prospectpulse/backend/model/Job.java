package com.prospectpulse.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status snapshot of a job, as stored in {@code jobs:{id}} and published on
 * {@code jobs:{id}:events}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("workspace_id")
    private String workspaceId;

    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    private double progress;

    private String error;
}
