package com.prospectpulse.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesized lead written once its job finished all stages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Lead {

    private String id;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("workspace_id")
    private String workspaceId;

    private String company;

    @JsonProperty("fit_score")
    private int fitScore;

    private String wedge;

    @JsonProperty("tech_stack")
    @Builder.Default
    private List<String> techStack = new ArrayList<>();

    @Builder.Default
    private List<String> signals = new ArrayList<>();
}
