package com.prospectpulse.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes job status snapshots to the per-job channel {@code jobs:{id}:events}
 * so observers in any process see transitions without polling.
 */
@Component
public class JobEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobEventPublisher.class);

    private final StoreClient storeClient;
    private final ObjectMapper objectMapper;

    public JobEventPublisher(StoreClient storeClient, ObjectMapper objectMapper) {
        this.storeClient = storeClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Best effort. The job hash is the source of truth, so a failed publish is
     * logged and dropped.
     *
     * @return true if the snapshot was handed to the store
     */
    public boolean publish(Job snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            storeClient.getSession().publish(StoreKeys.jobEvents(snapshot.getJobId()), json);
            log.debug("[PUB/SUB] Published {} for job: {}", snapshot.getStatus().value(), snapshot.getJobId());
            return true;
        } catch (Exception e) {
            log.warn("[PUB/SUB] Failed to publish status for job: {}", snapshot.getJobId(), e);
            return false;
        }
    }
}
