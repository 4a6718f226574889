package com.chuntfm.schedule.infrastructure.cron;

import com.chuntfm.schedule.domain.exception.StorageUnavailableException;
import com.chuntfm.schedule.infrastructure.cache.RefreshCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

/**
 * Verifies that the scheduler keeps running the freshness check.
 */
@SpringBootTest(classes = {
        ScheduledCacheRefresher.class,
        ScheduledCacheRefresherIntegrationTest.TestSchedulingConfig.class
})
@TestPropertySource(properties = {
        "chuntfm.cache.refresh.enabled=true",
        "chuntfm.cache.refresh.interval=100"
})
class ScheduledCacheRefresherIntegrationTest {

    @MockBean
    private RefreshCoordinator refreshCoordinator;

    @Configuration
    @EnableScheduling
    static class TestSchedulingConfig {
    }

    @Test
    void shouldRunFreshnessCheck() {
        // When - Wait for the scheduler to execute
        await()
                .atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(refreshCoordinator, atLeastOnce()).refreshIfStale());
    }

    @Test
    void shouldRunFreshnessCheckRepeatedly() {
        // When - Wait for multiple executions
        await()
                .atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(refreshCoordinator, atLeast(3)).refreshIfStale());
    }

    @Test
    void shouldKeepRunningAfterFailedRebuild() {
        // Given - First call fails
        when(refreshCoordinator.refreshIfStale())
                .thenThrow(new StorageUnavailableException("Connection refused"))
                .thenReturn(true);

        // When - Wait for the scheduler to call again after the failure
        await()
                .atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(refreshCoordinator, atLeast(2)).refreshIfStale());
    }
}
