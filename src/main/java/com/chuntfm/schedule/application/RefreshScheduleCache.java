package com.chuntfm.schedule.application;

import com.chuntfm.schedule.domain.exception.StorageUnavailableException;
import com.chuntfm.schedule.domain.model.RefreshResult;
import com.chuntfm.schedule.domain.port.out.ScheduleSnapshots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RefreshScheduleCache {

    private static final Logger logger = LoggerFactory.getLogger(RefreshScheduleCache.class);

    private final ScheduleSnapshots snapshots;

    public RefreshScheduleCache(ScheduleSnapshots snapshots) {
        this.snapshots = snapshots;
    }

    /**
     * Rebuilds the schedule snapshot on operator request.
     *
     * @throws StorageUnavailableException if the store could not be scanned
     */
    public RefreshResult execute() {
        logger.info("Starting requested refresh of the schedule cache");
        try {
            RefreshResult result = snapshots.forceRefresh();
            logger.info("Schedule cache refresh finished: {} (taken at {}, {} entries)",
                    result.status(), result.takenAt(), result.entryCount());
            return result;
        } catch (StorageUnavailableException e) {
            logger.error("Requested schedule cache refresh failed: {}", e.reason());
            throw e;
        }
    }
}
