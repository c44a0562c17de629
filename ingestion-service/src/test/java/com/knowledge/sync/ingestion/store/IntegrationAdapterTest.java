package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.exception.IntegrationNotFoundException;
import com.knowledge.sync.ingestion.model.SyncStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntegrationAdapterTest {

    @Mock
    private SyncRecordStore syncRecordStore;

    @Mock
    private IntegrationStore integrationStore;

    @InjectMocks
    private IntegrationAdapter integrationAdapter;

    @Test
    @DisplayName("A missing integration raises not found")
    void missingIntegration() {
        when(integrationStore.findIntegration("user-1", "int-1")).thenReturn(Optional.empty());

        assertThrows(IntegrationNotFoundException.class, () -> integrationAdapter.getIntegration("user-1", "int-1"));
    }

    @Test
    @DisplayName("Store failures are rethrown unchanged")
    void storeFailureIsRethrown() {
        UUID syncId = UUID.randomUUID();
        doThrow(new DataAccessResourceFailureException("mongo down"))
                .when(syncRecordStore).updateStatus("user-1", syncId, SyncStatus.FAILED, "x");

        assertThrows(DataAccessResourceFailureException.class,
                () -> integrationAdapter.updateSyncStatus("user-1", syncId, SyncStatus.FAILED, "x"));
    }

    @Test
    @DisplayName("Updating the checkpoint of an unknown integration reports false")
    void checkpointOfUnknownIntegration() {
        when(integrationStore.updateCheckpoint("user-1", "int-1", "2024-06-01T00:00:00Z")).thenReturn(false);

        assertFalse(integrationAdapter.updateCheckpoint("user-1", "int-1", "2024-06-01T00:00:00Z"));
    }
}
