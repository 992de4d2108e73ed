package com.prospectpulse.backend.service;

import com.prospectpulse.backend.exception.WriteNotDurableException;
import com.prospectpulse.backend.lock.DistributedLockManager;
import com.prospectpulse.backend.model.OperationKind;
import com.prospectpulse.backend.model.Workspace;
import com.prospectpulse.backend.model.WorkspaceProvider;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * A store that accepts writes but never returns them must surface as a failed create.
 */
class WorkspaceServiceDurabilityTest {

    private StoreSession session;
    private OperationLogService operationLog;
    private WorkspaceService workspaceService;

    @BeforeEach
    void setUp() {
        session = mock(StoreSession.class);
        when(session.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(session.compareAndDelete(anyString(), anyString())).thenReturn(true);

        StoreClient storeClient = mock(StoreClient.class);
        when(storeClient.getSession()).thenReturn(session);

        operationLog = mock(OperationLogService.class);
        when(operationLog.record(any(), anyString(), any())).thenReturn("op-1");

        DistributedLockManager lockManager = new DistributedLockManager(storeClient, Duration.ofSeconds(10),
                Duration.ofMillis(10));
        workspaceService = new WorkspaceService(storeClient, lockManager, operationLog);
    }

    @Test
    void shouldFailCreateWhenWriteIsNotReadable() {
        Workspace request = Workspace.builder().provider(WorkspaceProvider.OPENAI).openaiKey("sk-1").build();

        assertThrows(WriteNotDurableException.class, () -> workspaceService.create("ws-1", request));

        verify(session).hashPutAll(eq("workspaces:ws-1:keys"), anyMap());
        verify(operationLog).record(eq(OperationKind.CREATE), eq("ws-1"), any());
        verify(operationLog).markFailed(eq("op-1"), any(WriteNotDurableException.class));
        verify(operationLog, never()).markCompleted(anyString());
    }

    @Test
    void shouldReleaseLockAfterFailedCreate() {
        Workspace request = Workspace.builder().provider(WorkspaceProvider.GEMINI).geminiKey("g-1").build();

        assertThrows(WriteNotDurableException.class, () -> workspaceService.create("ws-1", request));

        verify(session).compareAndDelete(eq("locks:create:ws-1"), anyString());
    }
}
