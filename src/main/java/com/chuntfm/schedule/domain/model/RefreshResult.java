package com.chuntfm.schedule.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of an explicit cache refresh.
 * {@code snapshot} is the snapshot published when the call returned; it can be null only
 * while the very first rebuild is still running elsewhere.
 */
public record RefreshResult(
        Status status,
        CachedSnapshot snapshot
) {

    public enum Status {
        REFRESHED,
        ALREADY_IN_PROGRESS,
        SUPERSEDED
    }

    public RefreshResult {
        Objects.requireNonNull(status, "status");
    }

    public static RefreshResult refreshed(CachedSnapshot snapshot) {
        return new RefreshResult(Status.REFRESHED, Objects.requireNonNull(snapshot, "snapshot"));
    }

    public static RefreshResult alreadyInProgress(CachedSnapshot current) {
        return new RefreshResult(Status.ALREADY_IN_PROGRESS, current);
    }

    /**
     * The rebuild finished but a snapshot with a later {@code takenAt} was already published,
     * for instance after the clock stepped back.
     */
    public static RefreshResult superseded(CachedSnapshot published) {
        return new RefreshResult(Status.SUPERSEDED, Objects.requireNonNull(published, "published"));
    }

    public Instant takenAt() {
        return snapshot != null ? snapshot.takenAt() : null;
    }

    public int entryCount() {
        return snapshot != null ? snapshot.size() : 0;
    }
}
