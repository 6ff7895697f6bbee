package com.purchasingpower.compliancekb.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Stale Sync Job Reaper Tests")
class StaleSyncJobReaperTest {

    @Test
    @DisplayName("Each sweep applies the staleness policy once")
    void testReap_ShouldDelegateToManager() {
        // Given
        SyncJobManager manager = mock(SyncJobManager.class);
        when(manager.failStaleJobs()).thenReturn(2, 0);
        StaleSyncJobReaper reaper = new StaleSyncJobReaper(manager);

        // When
        reaper.reap();
        reaper.reap();

        // Then
        verify(manager, times(2)).failStaleJobs();
    }
}
