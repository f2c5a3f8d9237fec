package com.carintel.domain.usage.service;

import com.carintel.config.VehicleApiProperties;
import com.carintel.domain.usage.entity.UsageRecord;
import com.carintel.domain.usage.repository.UsageLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UsageLogServiceTest {

    @Mock
    private UsageLogRepository usageLogRepository;

    private UsageLogService usageLogService;

    @BeforeEach
    void setUp() {
        VehicleApiProperties properties = new VehicleApiProperties();
        properties.getUsage().setQueueCapacity(5);
        properties.getUsage().setBatchSize(2);
        usageLogService = new UsageLogService(usageLogRepository, properties);
    }

    @Test
    void shouldDropRecordsWhenQueueIsFull() {
        // Given
        for (int i = 0; i < 5; i++) {
            assertTrue(usageLogService.enqueue(record("/vehicles/years")));
        }

        // When
        boolean accepted = usageLogService.enqueue(record("/vehicles/search"));

        // Then
        assertFalse(accepted);
        assertEquals(1, usageLogService.getDroppedCount());
        assertEquals(5, usageLogService.getPendingCount());
    }

    @Test
    void shouldFlushInBatches() {
        // Given
        for (int i = 0; i < 5; i++) {
            usageLogService.enqueue(record("/vehicles/years"));
        }

        // When
        usageLogService.flush();

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<UsageRecord>> batches = ArgumentCaptor.forClass(List.class);
        verify(usageLogRepository, times(3)).insertBatch(batches.capture());
        assertEquals(List.of(2, 2, 1), batches.getAllValues().stream().map(List::size).collect(Collectors.toList()));
        assertEquals(0, usageLogService.getPendingCount());
    }

    @Test
    void shouldDiscardBatchWhenInsertFails() {
        // Given
        usageLogService.enqueue(record("/vehicles/years"));
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(usageLogRepository).insertBatch(anyList());

        // When
        usageLogService.flush();

        // Then
        assertEquals(0, usageLogService.getPendingCount());
        verify(usageLogRepository, times(1)).insertBatch(anyList());
    }

    @Test
    void shouldDrainQueueOnShutdown() {
        usageLogService.enqueue(record("/vehicles/years"));

        usageLogService.shutdown();

        verify(usageLogRepository).insertBatch(anyList());
        assertEquals(0, usageLogService.getPendingCount());
    }

    @Test
    void shouldNotTouchDatabaseWhenQueueIsEmpty() {
        usageLogService.flush();

        verifyNoInteractions(usageLogRepository);
    }

    private static UsageRecord record(String endpoint) {
        return UsageRecord.builder().endpoint(endpoint).method("GET").source("api").responseStatus(200).build();
    }
}
