package com.tripsync.server.consistency;

import com.tripsync.common.properties.StorageProperties;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.metrics.MetricsRecorder;
import com.tripsync.server.storage.TripDocumentStore;
import com.tripsync.server.validation.TripBoundaryValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static com.tripsync.server.TripFixtures.expense;
import static com.tripsync.server.TripFixtures.location;
import static com.tripsync.server.TripFixtures.trip;
import static com.tripsync.server.TripFixtures.withExpenses;
import static com.tripsync.server.TripFixtures.withLocations;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * 关联巡检任务：统计违规，单个行程失败不影响其他行程。
 */
@ExtendWith(MockitoExtension.class)
class TripLinkAuditTaskTest {

    @Mock
    private TripDocumentStore tripDocumentStore;

    @Mock
    private MetricsRecorder metricsRecorder;

    private StorageProperties storageProperties;
    private TripLinkAuditTask task;

    @BeforeEach
    void setUp() {
        storageProperties = new StorageProperties();
        task = new TripLinkAuditTask(tripDocumentStore, new TripBoundaryValidator(), storageProperties, metricsRecorder);
    }

    @Test
    void auditAllTrips_shouldCountViolationsAcrossTrips_andSkipBrokenOnes() throws Exception {
        TripDocument dangling = withExpenses(withLocations(trip("trip-a", 7), location("loc-1", "Lisbon", "ghost")),
                expense("e-1", "Food"));
        when(tripDocumentStore.listTripIds()).thenReturn(List.of("trip-a", "trip-b", "trip-c"));
        when(tripDocumentStore.load("trip-a")).thenReturn(Optional.of(dangling));
        when(tripDocumentStore.load("trip-b")).thenThrow(new IOException("permission denied"));
        when(tripDocumentStore.load("trip-c")).thenReturn(Optional.empty());

        task.auditAllTrips();

        verify(metricsRecorder).recordAuditViolations(1);
    }

    @Test
    void auditAllTrips_shouldDoNothing_whenDisabled() throws Exception {
        storageProperties.setLinkAuditEnabled(false);

        task.auditAllTrips();

        verify(tripDocumentStore, never()).load(anyString());
        verifyNoInteractions(metricsRecorder);
    }
}
