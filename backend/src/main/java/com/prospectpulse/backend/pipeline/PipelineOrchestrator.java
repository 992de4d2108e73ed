package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.exception.StageFailedException;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.model.Lead;
import com.prospectpulse.backend.service.JobStatusTracker;
import com.prospectpulse.backend.service.LeadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs the mine, validate and synthesize stages for the leads of one job.
 * <p>
 * Stages run stage by stage across the whole batch, so the job advances
 * exactly once per stage: mining 0.1, validating 0.4, synthesizing 0.7,
 * complete 1.0. Leads are written only after every stage succeeded for every
 * lead; any failure marks the job failed and is rethrown. A caller-supplied
 * lead id that is already stored fails the job and leaves the stored lead
 * untouched.
 * <p>
 * Callers must not run the same job id on two workers at once.
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final double MINING_PROGRESS = 0.1;
    static final double VALIDATING_PROGRESS = 0.4;
    static final double SYNTHESIZING_PROGRESS = 0.7;
    static final double COMPLETE_PROGRESS = 1.0;

    private final Miner miner;
    private final Validator validator;
    private final Synthesizer synthesizer;
    private final JobStatusTracker jobStatusTracker;
    private final LeadService leadService;

    public PipelineOrchestrator(Miner miner,
            Validator validator,
            Synthesizer synthesizer,
            JobStatusTracker jobStatusTracker,
            LeadService leadService) {
        this.miner = miner;
        this.validator = validator;
        this.synthesizer = synthesizer;
        this.jobStatusTracker = jobStatusTracker;
        this.leadService = leadService;
    }

    public Lead processLead(String jobId, Map<String, Object> lead, String workspaceId) {
        return run(jobId, List.of(lead), workspaceId).get(0);
    }

    /**
     * @return the persisted leads, in input order
     */
    public List<Lead> run(String jobId, List<Map<String, Object>> leads, String workspaceId) {
        log.info("[PIPELINE] Job: {} | Leads: {} | Workspace: {}", jobId, leads.size(), workspaceId);
        try {
            jobStatusTracker.update(jobId, JobStatus.MINING, MINING_PROGRESS);
            List<Map<String, Object>> mined = new ArrayList<>();
            for (Map<String, Object> lead : leads) {
                mined.add(invoke("mine", () -> miner.mine(lead)));
            }

            jobStatusTracker.update(jobId, JobStatus.VALIDATING, VALIDATING_PROGRESS);
            List<Map<String, Object>> validated = new ArrayList<>();
            for (Map<String, Object> lead : leads) {
                validated.add(invoke("validate", () -> validator.validate(lead)));
            }

            jobStatusTracker.update(jobId, JobStatus.SYNTHESIZING, SYNTHESIZING_PROGRESS);
            List<Lead> results = new ArrayList<>();
            for (int i = 0; i < leads.size(); i++) {
                Map<String, Object> lead = leads.get(i);
                Map<String, Object> minedLead = mined.get(i);
                Map<String, Object> validatedLead = validated.get(i);
                Map<String, Object> synthesized = invoke("synthesize",
                        () -> synthesizer.synthesize(lead, minedLead, validatedLead));
                results.add(toLead(jobId, workspaceId, lead, synthesized));
            }

            persist(results);
            jobStatusTracker.update(jobId, JobStatus.COMPLETE, COMPLETE_PROGRESS);
            log.info("[PIPELINE] Job: {} complete, {} leads written", jobId, results.size());
            return results;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[PIPELINE] Job: {} failed: {}", jobId, message);
            try {
                jobStatusTracker.fail(jobId, message);
            } catch (RuntimeException statusFailure) {
                log.error("[PIPELINE] Could not mark job {} failed", jobId, statusFailure);
                e.addSuppressed(statusFailure);
            }
            throw e;
        }
    }

    private void persist(List<Lead> results) {
        List<Lead> written = new ArrayList<>();
        try {
            for (Lead lead : results) {
                written.add(leadService.save(lead));
            }
        } catch (RuntimeException e) {
            for (Lead lead : written) {
                try {
                    leadService.delete(lead);
                } catch (RuntimeException cleanup) {
                    log.warn("[PIPELINE] Could not remove partial lead {}", lead.getId(), cleanup);
                }
            }
            throw e;
        }
    }

    private static Map<String, Object> invoke(String stage, Supplier<Map<String, Object>> call) {
        try {
            Map<String, Object> output = call.get();
            if (output == null) {
                throw new StageFailedException(stage, "stage returned no output");
            }
            return output;
        } catch (StageFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageFailedException(stage, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }

    private static Lead toLead(String jobId, String workspaceId, Map<String, Object> input,
            Map<String, Object> synthesized) {
        Object suppliedId = input.get("id");
        Object score = synthesized.get(LeadFields.FIT_SCORE);
        Object wedge = synthesized.get(LeadFields.WEDGE);
        return Lead.builder()
                .id(suppliedId != null ? suppliedId.toString() : UUID.randomUUID().toString())
                .jobId(jobId)
                .workspaceId(workspaceId)
                .company(LeadFields.company(synthesized))
                .fitScore(score instanceof Number number ? number.intValue() : 0)
                .wedge(wedge != null ? wedge.toString() : "")
                .techStack(LeadFields.strings(synthesized, LeadFields.TECH_STACK))
                .signals(LeadFields.strings(synthesized, LeadFields.SIGNALS))
                .build();
    }
}
