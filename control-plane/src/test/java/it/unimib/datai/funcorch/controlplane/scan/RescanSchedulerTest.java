package it.unimib.datai.funcorch.controlplane.scan;

import it.unimib.datai.funcorch.controlplane.config.ScanProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RescanSchedulerTest {

    @Test
    void tickOnce_failureIsLoggedAndNextTickRuns() {
        IndexingService indexingService = mock(IndexingService.class);
        when(indexingService.rescanAll()).thenThrow(new IllegalStateException("boom")).thenReturn(3);
        RescanScheduler scheduler = new RescanScheduler(indexingService,
                new ScanProperties(null, true, Duration.ofMinutes(1)));

        scheduler.tickOnce();
        scheduler.tickOnce();

        verify(indexingService, times(2)).rescanAll();
    }

    @Test
    void startAndStop_runRescansOnSchedule() {
        IndexingService indexingService = mock(IndexingService.class);
        RescanScheduler scheduler = new RescanScheduler(indexingService,
                new ScanProperties(null, true, Duration.ofMillis(20)));

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        verify(indexingService, timeout(2000).atLeast(2)).rescanAll();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
