package com.prospectpulse.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectpulse.backend.model.Operation;
import com.prospectpulse.backend.model.OperationKind;
import com.prospectpulse.backend.model.OperationStatus;
import com.prospectpulse.backend.store.StoreKeys;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Bounded-lifetime audit trail of workspace mutations.
 * <p>
 * Each record is written as {@code pending} before the guarded action runs and
 * receives exactly one terminal update from the same caller. Records expire
 * through the store's key TTL; nothing here replays or sweeps them.
 */
@Service
public class OperationLogService {

    private static final Logger log = LoggerFactory.getLogger(OperationLogService.class);

    private static final String FIELD_ID = "operation_id";
    private static final String FIELD_TYPE = "operation_type";
    private static final String FIELD_TARGET = "workspace_id";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_ERROR = "error";

    private final StoreClient storeClient;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public OperationLogService(StoreClient storeClient,
            ObjectMapper objectMapper,
            @Value("${prospectpulse.operations.ttl:30s}") Duration ttl) {
        this(storeClient, objectMapper, ttl, Clock.systemUTC());
    }

    OperationLogService(StoreClient storeClient, ObjectMapper objectMapper, Duration ttl, Clock clock) {
        this.storeClient = storeClient;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Writes a pending operation record.
     *
     * @return the new operation id
     */
    public String record(OperationKind kind, String targetId, Object payload) {
        Operation operation = Operation.builder()
                .operationId(UUID.randomUUID().toString())
                .kind(kind)
                .targetId(targetId)
                .payload(toJson(payload))
                .status(OperationStatus.PENDING)
                .createdAt(clock.instant())
                .build();

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_ID, operation.getOperationId());
        fields.put(FIELD_TYPE, kind.value());
        fields.put(FIELD_TARGET, targetId);
        fields.put(FIELD_DATA, operation.getPayload());
        fields.put(FIELD_TIMESTAMP, operation.getCreatedAt().toString());
        fields.put(FIELD_STATUS, OperationStatus.PENDING.value());
        fields.put(FIELD_ERROR, "");

        String key = StoreKeys.operation(operation.getOperationId());
        StoreSession session = storeClient.getSession();
        session.hashPutAll(key, fields);
        session.expire(key, ttl);

        log.debug("[OPLOG] Recorded {} on {} as {}", kind.value(), targetId, operation.getOperationId());
        return operation.getOperationId();
    }

    /**
     * Terminal update. Failures are logged so they never mask the outcome of
     * the action being recorded.
     */
    public void mark(String operationId, OperationStatus status, String error) {
        String key = StoreKeys.operation(operationId);
        try {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(FIELD_STATUS, status.value());
            fields.put(FIELD_ERROR, error != null ? error : "");
            StoreSession session = storeClient.getSession();
            if (session.hashGetAll(key).isEmpty()) {
                log.warn("[OPLOG] Operation {} expired before it could be marked {}", operationId, status.value());
                return;
            }
            session.hashPutAll(key, fields);
            // the record may have expired between the check and the write; never leave it unbounded
            session.expire(key, ttl);
            log.debug("[OPLOG] Operation {} marked {}", operationId, status.value());
        } catch (RuntimeException e) {
            log.warn("[OPLOG] Failed to mark operation {} as {}: {}", operationId, status.value(), e.getMessage());
        }
    }

    public void markCompleted(String operationId) {
        mark(operationId, OperationStatus.COMPLETED, null);
    }

    public void markFailed(String operationId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        mark(operationId, OperationStatus.FAILED, message);
    }

    /**
     * Reads an operation back for diagnosis; empty once it has expired.
     */
    public Optional<Operation> find(String operationId) {
        Map<String, String> fields = storeClient.getSession().hashGetAll(StoreKeys.operation(operationId));
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        String error = fields.get(FIELD_ERROR);
        return Optional.of(Operation.builder()
                .operationId(operationId)
                .kind(parseOrNull(fields.get(FIELD_TYPE), OperationKind::fromValue))
                .targetId(fields.get(FIELD_TARGET))
                .payload(fields.get(FIELD_DATA))
                .status(parseOrNull(fields.get(FIELD_STATUS), OperationStatus::fromValue))
                .error(error == null || error.isEmpty() ? null : error)
                .createdAt(parseOrNull(fields.get(FIELD_TIMESTAMP), Instant::parse))
                .build());
    }

    // Records may be partial (written by another process or cut short by expiry).
    private static <T> T parseOrNull(String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (RuntimeException e) {
            log.warn("[OPLOG] Ignoring unreadable operation field value: {}", value);
            return null;
        }
    }

    private String toJson(Object payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Operation payload is not serializable", e);
        }
    }
}
