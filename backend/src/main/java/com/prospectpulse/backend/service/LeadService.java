package com.prospectpulse.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.model.Lead;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreKeys;
import com.prospectpulse.backend.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists synthesized leads as {@code leads:{id}} hashes. List-valued fields
 * are stored as JSON strings.
 */
@Service
public class LeadService {

    private static final Logger log = LoggerFactory.getLogger(LeadService.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final StoreClient storeClient;
    private final ObjectMapper objectMapper;

    public LeadService(StoreClient storeClient, ObjectMapper objectMapper) {
        this.storeClient = storeClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Write a new lead and, when it belongs to a job, append its id to
     * {@code jobs:{jobId}:leads}.
     *
     * @throws IllegalStateException if a lead with the same id is already stored
     */
    public Lead save(Lead lead) {
        StoreSession session = storeClient.getSession();
        String key = StoreKeys.lead(lead.getId());
        if (!session.hashGetAll(key).isEmpty()) {
            throw new IllegalStateException("Lead already exists: " + lead.getId());
        }
        session.hashPutAll(key, toFields(lead));
        if (lead.getJobId() != null) {
            session.listPush(StoreKeys.jobLeads(lead.getJobId()), lead.getId());
        }
        log.debug("[LEAD] Saved lead: {} ({})", lead.getId(), lead.getCompany());
        return lead;
    }

    /**
     * Removes a lead and its entry in the job's lead list. Used to roll back a
     * job whose persistence step failed part way.
     */
    public void delete(Lead lead) {
        StoreSession session = storeClient.getSession();
        session.delete(StoreKeys.lead(lead.getId()));
        if (lead.getJobId() != null) {
            session.listRemove(StoreKeys.jobLeads(lead.getJobId()), lead.getId());
        }
    }

    /**
     * One page of all leads, ordered by key.
     *
     * @param page 1-based
     */
    public LeadPage list(int page, int size) {
        StoreSession session = storeClient.getSession();
        List<String> keys = new ArrayList<>(session.scan(StoreKeys.LEAD_PATTERN));
        keys.sort(null);

        long from = Math.max(0L, ((long) page - 1) * size);
        long to = Math.min(keys.size(), from + size);
        List<Lead> items = new ArrayList<>();
        for (String key : from < to ? keys.subList((int) from, (int) to) : List.<String>of()) {
            Map<String, String> fields = session.hashGetAll(key);
            if (!fields.isEmpty()) {
                items.add(fromFields(key.substring("leads:".length()), fields));
            }
        }
        return new LeadPage(items, page, size, keys.size());
    }

    public List<Lead> listByJob(String jobId) {
        StoreSession session = storeClient.getSession();
        List<Lead> leads = new ArrayList<>();
        for (String leadId : session.listRange(StoreKeys.jobLeads(jobId))) {
            Map<String, String> fields = session.hashGetAll(StoreKeys.lead(leadId));
            if (!fields.isEmpty()) {
                leads.add(fromFields(leadId, fields));
            }
        }
        return leads;
    }

    private Map<String, String> toFields(Lead lead) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", lead.getId());
        if (lead.getJobId() != null) {
            fields.put("job_id", lead.getJobId());
        }
        if (lead.getWorkspaceId() != null) {
            fields.put("workspace_id", lead.getWorkspaceId());
        }
        fields.put("company", lead.getCompany() != null ? lead.getCompany() : "");
        fields.put("fit_score", String.valueOf(lead.getFitScore()));
        fields.put("wedge", lead.getWedge() != null ? lead.getWedge() : "");
        fields.put("tech_stack", writeList(lead.getTechStack()));
        fields.put("signals", writeList(lead.getSignals()));
        return fields;
    }

    private Lead fromFields(String leadId, Map<String, String> fields) {
        String score = fields.get("fit_score");
        return Lead.builder()
                .id(fields.getOrDefault("id", leadId))
                .jobId(fields.get("job_id"))
                .workspaceId(fields.get("workspace_id"))
                .company(fields.get("company"))
                .fitScore(score != null && !score.isEmpty() ? Integer.parseInt(score) : 0)
                .wedge(fields.get("wedge"))
                .techStack(readList(fields.get("tech_stack")))
                .signals(readList(fields.get("signals")))
                .build();
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode lead field", e);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[LEAD] Unreadable list field, returning empty: {}", json);
            return new ArrayList<>();
        }
    }

    /**
     * A page of leads plus the total number of lead records.
     */
    public record LeadPage(List<Lead> items, int page, int size, int total) {
    }
}
