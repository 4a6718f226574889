package com.chuntfm.schedule.infrastructure.cron;

import com.chuntfm.schedule.infrastructure.cache.RefreshCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically runs the same freshness check as a read request, so an idle service
 * still picks up schedule changes.
 */
@Service
@ConditionalOnProperty(prefix = "chuntfm.cache.refresh", name = "enabled", havingValue = "true")
public class ScheduledCacheRefresher {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCacheRefresher.class);
    private final RefreshCoordinator refreshCoordinator;

    public ScheduledCacheRefresher(RefreshCoordinator refreshCoordinator) {
        this.refreshCoordinator = refreshCoordinator;
    }

    @Scheduled(fixedDelayString = "${chuntfm.cache.refresh.interval:60000}")
    public void refresh() {
        logger.debug("Running scheduled schedule cache check");
        try {
            if (refreshCoordinator.refreshIfStale()) {
                logger.info("Scheduled check rebuilt the schedule cache");
            }
        } catch (RuntimeException e) {
            logger.warn("Scheduled schedule cache check failed: {}", e.getMessage());
        }
    }
}
