package com.prospectpulse.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreKeys;
import com.prospectpulse.backend.store.StoreSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Subscribes observers to the status channel of a single job.
 */
@Component
public class JobEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(JobEventSubscriber.class);

    private final StoreClient storeClient;
    private final ObjectMapper objectMapper;

    public JobEventSubscriber(StoreClient storeClient, ObjectMapper objectMapper) {
        this.storeClient = storeClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Deliver every decodable snapshot published for {@code jobId} until the
     * returned subscription is closed. Malformed messages are logged and skipped.
     */
    public StoreSubscription subscribe(String jobId, Consumer<Job> listener) {
        return storeClient.getSession().subscribe(StoreKeys.jobEvents(jobId), message -> {
            Job snapshot;
            try {
                snapshot = objectMapper.readValue(message, Job.class);
            } catch (Exception e) {
                log.warn("[PUB/SUB] Dropping malformed message for job {}: {}", jobId, message);
                return;
            }
            if (snapshot.getJobId() == null) {
                snapshot.setJobId(jobId);
            }
            listener.accept(snapshot);
        });
    }
}
