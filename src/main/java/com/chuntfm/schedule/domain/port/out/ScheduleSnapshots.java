package com.chuntfm.schedule.domain.port.out;

import com.chuntfm.schedule.domain.model.CachedSnapshot;
import com.chuntfm.schedule.domain.model.RefreshResult;

/**
 * Access to the time-partitioned schedule snapshot.
 * Implementations decide when a rebuild is needed; callers only see published snapshots.
 */
public interface ScheduleSnapshots {

    /**
     * Returns the freshest published snapshot, refreshing it first when it is stale.
     * A failed refresh is not reported while an older snapshot can still be served.
     *
     * @throws com.chuntfm.schedule.domain.exception.StorageUnavailableException if no snapshot
     *         has ever been published and one could not be built
     */
    CachedSnapshot current();

    /**
     * Rebuilds the snapshot regardless of its age. If a rebuild is already running the call
     * returns immediately with {@link RefreshResult.Status#ALREADY_IN_PROGRESS}; if a snapshot
     * taken later is already published the result is {@link RefreshResult.Status#SUPERSEDED}.
     *
     * @throws com.chuntfm.schedule.domain.exception.StorageUnavailableException if the rebuild fails
     */
    RefreshResult forceRefresh();
}
