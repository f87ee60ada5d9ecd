package org.civicroute.engine.scheduler;

import org.civicroute.engine.cache.HandlingUnitRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RegistryRefreshScheduler.
 */
@ExtendWith(MockitoExtension.class)
class RegistryRefreshSchedulerTest {

    @Mock
    private HandlingUnitRegistry registry;

    private RegistryRefreshScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    @DisplayName("Should refresh repeatedly at the configured interval")
    void shouldRefreshPeriodically() {
        when(registry.refresh()).thenReturn(true);
        scheduler = new RegistryRefreshScheduler(registry, Duration.ofMillis(50));

        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(registry, timeout(2000).atLeast(2)).refresh();
    }

    @Test
    @DisplayName("Should keep running after a refresh throws")
    void shouldSurviveFailingCycle() {
        when(registry.refresh())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(false)
                .thenReturn(true);
        scheduler = new RegistryRefreshScheduler(registry, Duration.ofMillis(50));

        scheduler.start();

        verify(registry, timeout(2000).atLeast(3)).refresh();
    }

    @Test
    @DisplayName("Should not run before the first interval elapses and stop cleanly")
    void shouldWaitForFirstIntervalAndStop() {
        scheduler = new RegistryRefreshScheduler(registry, Duration.ofHours(1));

        scheduler.start();
        scheduler.start();
        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        verify(registry, never()).refresh();
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void shouldRejectInvalidInterval() {
        assertThatThrownBy(() -> new RegistryRefreshScheduler(registry, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
