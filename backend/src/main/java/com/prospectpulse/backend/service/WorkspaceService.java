package com.prospectpulse.backend.service;

import com.prospectpulse.backend.exception.InvalidRecordException;
import com.prospectpulse.backend.exception.NotFoundException;
import com.prospectpulse.backend.exception.WriteNotDurableException;
import com.prospectpulse.backend.lock.DistributedLockManager;
import com.prospectpulse.backend.model.OperationKind;
import com.prospectpulse.backend.model.Workspace;
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
import java.util.UUID;

/**
 * CRUD over workspace records. Every mutation holds a per-workspace lock and
 * is recorded in the operation log; reads take no lock.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final StoreClient storeClient;
    private final DistributedLockManager lockManager;
    private final OperationLogService operationLog;

    public WorkspaceService(StoreClient storeClient,
            DistributedLockManager lockManager,
            OperationLogService operationLog) {
        this.storeClient = storeClient;
        this.lockManager = lockManager;
        this.operationLog = operationLog;
    }

    /**
     * Create a workspace. A repeated create for an existing id returns the
     * stored record unchanged.
     *
     * @param workspaceId caller-chosen id, or null for a random UUID
     */
    public Workspace create(String workspaceId, Workspace fields) {
        String id = workspaceId != null && !workspaceId.isBlank() ? workspaceId : UUID.randomUUID().toString();
        Map<String, String> mapping = fields.toFields();
        String operationId = operationLog.record(OperationKind.CREATE, id, auditPayload(mapping));

        String resource = "create:" + id;
        String token = null;
        try {
            token = lockManager.acquire(resource);
            StoreSession session = storeClient.getSession();
            String key = StoreKeys.workspace(id);

            Map<String, String> existing = session.hashGetAll(key);
            if (!existing.isEmpty()) {
                log.info("[WORKSPACE] {} already exists, returning stored record", id);
                Workspace stored = parse(id, existing);
                operationLog.markCompleted(operationId);
                return stored;
            }

            session.hashPutAll(key, mapping);
            Workspace stored = readBack(session, id);

            operationLog.markCompleted(operationId);
            log.info("[WORKSPACE] Created {} (provider {})", id, stored.getProvider().value());
            return stored;
        } catch (RuntimeException e) {
            operationLog.markFailed(operationId, e);
            log.error("[WORKSPACE] Create failed for {}: {}", id, e.getMessage());
            throw e;
        } finally {
            release(resource, token);
        }
    }

    public Workspace get(String workspaceId) {
        Map<String, String> fields = storeClient.getSession().hashGetAll(StoreKeys.workspace(workspaceId));
        if (fields.isEmpty()) {
            throw new NotFoundException("Workspace", workspaceId);
        }
        return parse(workspaceId, fields);
    }

    public boolean exists(String workspaceId) {
        return !storeClient.getSession().hashGetAll(StoreKeys.workspace(workspaceId)).isEmpty();
    }

    /**
     * Scan then read each key. Not a snapshot: records created or deleted
     * while the scan runs may or may not appear, and keys that vanish between
     * scan and read are skipped, as are records that cannot be parsed.
     */
    public List<Workspace> list() {
        StoreSession session = storeClient.getSession();
        List<Workspace> items = new ArrayList<>();
        for (String key : session.scan(StoreKeys.WORKSPACE_PATTERN)) {
            String id = StoreKeys.workspaceIdFromKey(key);
            if (id == null) {
                continue;
            }
            Map<String, String> fields = session.hashGetAll(key);
            if (fields.isEmpty()) {
                continue;
            }
            try {
                items.add(parse(id, fields));
            } catch (InvalidRecordException e) {
                log.warn("[WORKSPACE] Skipping {} in listing: {}", key, e.getMessage());
            }
        }
        log.debug("[WORKSPACE] Listed {} workspaces", items.size());
        return items;
    }

    /**
     * Replace the full record of an existing workspace.
     */
    public Workspace update(String workspaceId, Workspace fields) {
        Map<String, String> mapping = fields.toFields();
        String operationId = operationLog.record(OperationKind.UPDATE, workspaceId, auditPayload(mapping));

        String resource = "update:" + workspaceId;
        String token = null;
        try {
            token = lockManager.acquire(resource);
            StoreSession session = storeClient.getSession();
            String key = StoreKeys.workspace(workspaceId);
            if (session.hashGetAll(key).isEmpty()) {
                throw new NotFoundException("Workspace", workspaceId);
            }

            // every field is written, so the record is replaced in place and stays readable
            session.hashPutAll(key, mapping);
            Workspace stored = readBack(session, workspaceId);

            operationLog.markCompleted(operationId);
            log.info("[WORKSPACE] Updated {}", workspaceId);
            return stored;
        } catch (RuntimeException e) {
            operationLog.markFailed(operationId, e);
            throw e;
        } finally {
            release(resource, token);
        }
    }

    /**
     * @throws NotFoundException if the workspace does not exist
     */
    public boolean delete(String workspaceId) {
        String operationId = operationLog.record(OperationKind.DELETE, workspaceId, Map.of());

        String resource = "delete:" + workspaceId;
        String token = null;
        try {
            token = lockManager.acquire(resource);
            StoreSession session = storeClient.getSession();
            String key = StoreKeys.workspace(workspaceId);
            if (session.hashGetAll(key).isEmpty()) {
                throw new NotFoundException("Workspace", workspaceId);
            }

            session.delete(key);
            operationLog.markCompleted(operationId);
            log.info("[WORKSPACE] Deleted {}", workspaceId);
            return true;
        } catch (RuntimeException e) {
            operationLog.markFailed(operationId, e);
            throw e;
        } finally {
            release(resource, token);
        }
    }

    private Workspace readBack(StoreSession session, String workspaceId) {
        String key = StoreKeys.workspace(workspaceId);
        Map<String, String> stored = session.hashGetAll(key);
        if (stored.isEmpty()) {
            throw new WriteNotDurableException(key);
        }
        return parse(workspaceId, stored);
    }

    private static Workspace parse(String workspaceId, Map<String, String> fields) {
        try {
            return Workspace.fromFields(workspaceId, fields);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException(StoreKeys.workspace(workspaceId), e.getMessage(), e);
        }
    }

    private void release(String resource, String token) {
        if (token != null) {
            lockManager.release(resource, token);
        }
    }

    // Credentials never reach the operation log.
    private static Map<String, String> auditPayload(Map<String, String> mapping) {
        Map<String, String> payload = new LinkedHashMap<>();
        mapping.forEach((field, value) -> {
            if (Workspace.FIELD_PROVIDER.equals(field)) {
                payload.put(field, value);
            } else {
                payload.put(field, value == null || value.isEmpty() ? "" : "***");
            }
        });
        return payload;
    }
}
