package com.prospectpulse.backend.service;

import com.prospectpulse.backend.exception.NotFoundException;
import com.prospectpulse.backend.model.Job;
import com.prospectpulse.backend.model.JobStatus;
import com.prospectpulse.backend.pubsub.JobEventPublisher;
import com.prospectpulse.backend.pubsub.JobEventSubscriber;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreKeys;
import com.prospectpulse.backend.store.StoreSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Durable job status in {@code jobs:{id}} plus live propagation over
 * {@code jobs:{id}:events}.
 * <p>
 * Writes are not locked: one executor owns a job at a time. Status only moves
 * forward; a write ranking below the stored status, or any write after a
 * terminal status, is rejected and the stored state returned.
 */
@Service
public class JobStatusTracker {

    private static final Logger log = LoggerFactory.getLogger(JobStatusTracker.class);

    static final String FIELD_STATUS = "status";
    static final String FIELD_PROGRESS = "progress";
    static final String FIELD_ERROR = "error";
    static final String FIELD_WORKSPACE = "workspace_id";

    private final StoreClient storeClient;
    private final JobEventPublisher publisher;
    private final JobEventSubscriber subscriber;
    private final Duration streamTimeout;
    private final Duration pollInterval;

    @Autowired
    public JobStatusTracker(StoreClient storeClient,
            JobEventPublisher publisher,
            JobEventSubscriber subscriber,
            @Value("${prospectpulse.jobs.stream-timeout:60s}") Duration streamTimeout) {
        this(storeClient, publisher, subscriber, streamTimeout, Duration.ofMillis(500));
    }

    JobStatusTracker(StoreClient storeClient,
            JobEventPublisher publisher,
            JobEventSubscriber subscriber,
            Duration streamTimeout,
            Duration pollInterval) {
        this.storeClient = storeClient;
        this.publisher = publisher;
        this.subscriber = subscriber;
        this.streamTimeout = streamTimeout;
        this.pollInterval = pollInterval;
    }

    /**
     * Record a new job as {@code queued} with progress 0.
     */
    public Job create(String jobId, String workspaceId) {
        Job job = Job.builder()
                .jobId(jobId)
                .workspaceId(workspaceId)
                .status(JobStatus.QUEUED)
                .progress(0.0)
                .build();

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_STATUS, job.getStatus().value());
        fields.put(FIELD_PROGRESS, String.valueOf(job.getProgress()));
        if (workspaceId != null) {
            fields.put(FIELD_WORKSPACE, workspaceId);
        }
        storeClient.getSession().hashPutAll(StoreKeys.job(jobId), fields);
        publisher.publish(job);

        log.info("[JOB] Created job: {} (workspace {})", jobId, workspaceId);
        return job;
    }

    /**
     * Advance a job. The hash is written first, then the snapshot is published
     * best-effort.
     *
     * @return the state now stored, which is the previous state if the write was rejected
     */
    public Job update(String jobId, JobStatus status, Double progress, String error) {
        Optional<Job> current = find(jobId);
        if (current.isPresent() && !isForward(current.get().getStatus(), status)) {
            log.warn("[JOB] Rejected transition {} -> {} for job: {}",
                    current.get().getStatus().value(), status.value(), jobId);
            return current.get();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_STATUS, status.value());
        if (progress != null) {
            fields.put(FIELD_PROGRESS, String.valueOf(progress));
        }
        if (error != null && !error.isEmpty()) {
            fields.put(FIELD_ERROR, error);
        }
        storeClient.getSession().hashPutAll(StoreKeys.job(jobId), fields);

        Job snapshot = Job.builder()
                .jobId(jobId)
                .workspaceId(current.map(Job::getWorkspaceId).orElse(null))
                .status(status)
                .progress(progress != null ? progress : current.map(Job::getProgress).orElse(0.0))
                .error(error != null && !error.isEmpty() ? error : current.map(Job::getError).orElse(null))
                .build();
        publisher.publish(snapshot);

        log.info("[JOB] Job: {} -> {} ({})", jobId, status.value(), snapshot.getProgress());
        return snapshot;
    }

    public Job update(String jobId, JobStatus status, double progress) {
        return update(jobId, status, progress, null);
    }

    public Job fail(String jobId, String error) {
        return update(jobId, JobStatus.FAILED, null, error != null && !error.isEmpty() ? error : "unknown error");
    }

    /**
     * @throws NotFoundException for an unknown job id
     */
    public Job get(String jobId) {
        return find(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    public Optional<Job> find(String jobId) {
        Map<String, String> fields = storeClient.getSession().hashGetAll(StoreKeys.job(jobId));
        if (fields.isEmpty() || fields.get(FIELD_STATUS) == null) {
            return Optional.empty();
        }
        String progress = fields.get(FIELD_PROGRESS);
        String error = fields.get(FIELD_ERROR);
        return Optional.of(Job.builder()
                .jobId(jobId)
                .workspaceId(fields.get(FIELD_WORKSPACE))
                .status(JobStatus.fromValue(fields.get(FIELD_STATUS)))
                .progress(progress != null && !progress.isEmpty() ? Double.parseDouble(progress) : 0.0)
                .error(error != null && !error.isEmpty() ? error : null)
                .build());
    }

    public Job stream(String jobId, Consumer<Job> sink) {
        return stream(jobId, sink, streamTimeout);
    }

    /**
     * Feed {@code sink} the stored state, then every later state, until the
     * job reaches a terminal status or {@code budget} runs out. The stream
     * ends normally in both cases. Between channel messages the hash is
     * re-read every poll interval, so a lost publish only delays an event.
     * Emitted statuses never go backwards.
     *
     * @return the last state handed to the sink
     * @throws NotFoundException if the job does not exist when the stream opens
     */
    public Job stream(String jobId, Consumer<Job> sink, Duration budget) {
        BlockingQueue<Job> events = new LinkedBlockingQueue<>();
        // subscribe before the first read so nothing published in between is lost
        try (StoreSubscription ignored = subscriber.subscribe(jobId, events::offer)) {
            Job last = get(jobId);
            sink.accept(last);
            if (last.getStatus().isTerminal()) {
                return last;
            }

            long deadline = System.nanoTime() + budget.toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("[JOB] Stream budget exhausted for job: {}", jobId);
                    return last;
                }

                Job next = events.poll(Math.min(remaining, pollInterval.toNanos()), TimeUnit.NANOSECONDS);
                if (next == null) {
                    next = find(jobId).orElse(null);
                }
                if (next == null || !advances(last, next)) {
                    continue;
                }

                sink.accept(next);
                last = next;
                if (last.getStatus().isTerminal()) {
                    return last;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[JOB] Stream interrupted for job: {}", jobId);
            return find(jobId).orElse(null);
        }
    }

    private static boolean isForward(JobStatus from, JobStatus to) {
        if (from.isTerminal()) {
            return false;
        }
        return to.rank() >= from.rank();
    }

    private static boolean advances(Job last, Job next) {
        if (next.getStatus().rank() < last.getStatus().rank()) {
            return false;
        }
        return next.getStatus() != last.getStatus()
                || next.getProgress() != last.getProgress()
                || !Objects.equals(next.getError(), last.getError());
    }
}
