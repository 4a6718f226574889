package com.chuntfm.schedule.infrastructure.cache;

import com.chuntfm.schedule.domain.exception.StorageUnavailableException;
import com.chuntfm.schedule.domain.model.CachedSnapshot;
import com.chuntfm.schedule.domain.model.RefreshResult;
import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.domain.model.StalenessMarker;
import com.chuntfm.schedule.domain.port.out.RefreshMetadataService;
import com.chuntfm.schedule.domain.port.out.ScheduleReader;
import com.chuntfm.schedule.domain.port.out.ScheduleSnapshots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when the schedule snapshot must be rebuilt and makes sure at most one rebuild runs at a time.
 *
 * <p>A caller that finds a rebuild already running does not wait for it and does not start another;
 * it is served the snapshot currently published. Staleness is therefore tolerated for the duration
 * of one rebuild. The only exception is the very first build after start-up, when there is no
 * snapshot to serve yet and readers wait up to {@code initial-load-timeout}, or until that build fails.
 */
@Component
public class RefreshCoordinator implements ScheduleSnapshots {

    private static final Logger logger = LoggerFactory.getLogger(RefreshCoordinator.class);

    enum RefreshTrigger {
        INITIAL_LOAD,
        TTL_EXPIRED,
        STALENESS_DETECTED,
        ADMIN_REQUEST
    }

    private final PartitionCache partitionCache;
    private final ScheduleReader scheduleReader;
    private final StalenessDetector stalenessDetector;
    private final ScheduleCacheConfig config;
    private final RefreshMetadataService metadataService;
    private final Clock clock;

    // Held for the whole rebuild; tryLock() only, nobody waits on it
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final AtomicReference<Instant> lastProbeAt = new AtomicReference<>();
    private volatile StalenessMarker marker;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong rebuilds = new AtomicLong();
    private final AtomicLong failedRebuilds = new AtomicLong();
    private final AtomicLong skippedRebuilds = new AtomicLong();

    public RefreshCoordinator(PartitionCache partitionCache,
                              ScheduleReader scheduleReader,
                              StalenessDetector stalenessDetector,
                              ScheduleCacheConfig config,
                              RefreshMetadataService metadataService,
                              Clock clock) {
        this.partitionCache = partitionCache;
        this.scheduleReader = scheduleReader;
        this.stalenessDetector = stalenessDetector;
        this.config = config;
        this.metadataService = metadataService;
        this.clock = clock;
    }

    @Override
    public CachedSnapshot current() {
        CompletableFuture<CachedSnapshot> firstLoad = partitionCache.pendingFirstLoad();
        StorageUnavailableException failure = null;
        try {
            refreshIfStale();
        } catch (StorageUnavailableException e) {
            failure = e;
        }

        CachedSnapshot snapshot = partitionCache.read();
        if (snapshot != null) {
            if (failure != null) {
                logger.warn("Serving snapshot taken at {} after failed refresh: {}",
                        snapshot.takenAt(), failure.reason());
            }
            return snapshot;
        }

        if (failure != null) {
            throw failure;
        }

        // Another thread owns the initial build
        return partitionCache.awaitFirstPublication(firstLoad, config.getInitialLoadTimeout())
                .orElseThrow(() -> new StorageUnavailableException("Schedule cache is not loaded yet"));
    }

    /**
     * Rebuilds the snapshot if there is none yet, its TTL has elapsed or the storage
     * fingerprint changed. Returns without touching the rebuild lock when the snapshot is fresh.
     *
     * @return true if this call published a new snapshot
     * @throws StorageUnavailableException if this call ran a rebuild and it failed
     */
    public boolean refreshIfStale() {
        CachedSnapshot current = partitionCache.read();
        Optional<RefreshTrigger> trigger = current == null
                ? Optional.of(RefreshTrigger.INITIAL_LOAD)
                : refreshReason(current);

        if (trigger.isEmpty()) {
            hits.incrementAndGet();
            return false;
        }

        misses.incrementAndGet();
        return tryRebuild(trigger.get())
                .map(result -> result.status() == RefreshResult.Status.REFRESHED)
                .orElse(false);
    }

    @Override
    public RefreshResult forceRefresh() {
        Optional<RefreshResult> rebuilt = tryRebuild(RefreshTrigger.ADMIN_REQUEST);
        if (rebuilt.isPresent()) {
            return rebuilt.get();
        }

        logger.info("Refresh requested while a rebuild is running; returning the published snapshot");
        return RefreshResult.alreadyInProgress(partitionCache.read());
    }

    public boolean isRebuildInProgress() {
        return rebuildLock.isLocked();
    }

    public CacheStats getStats() {
        CachedSnapshot snapshot = partitionCache.read();
        return new CacheStats(
                snapshot != null ? snapshot.takenAt() : null,
                snapshot != null ? snapshot.previous().size() : 0,
                snapshot != null ? snapshot.now().size() : 0,
                snapshot != null ? snapshot.upNext().size() : 0,
                hits.get(),
                misses.get(),
                rebuilds.get(),
                failedRebuilds.get(),
                skippedRebuilds.get(),
                isRebuildInProgress()
        );
    }

    private Optional<RefreshTrigger> refreshReason(CachedSnapshot snapshot) {
        Instant now = clock.instant();

        if (config.isTtlEnabled() && !snapshot.takenAt().plus(config.getTtl()).isAfter(now)) {
            logger.debug("Snapshot taken at {} exceeded TTL {}", snapshot.takenAt(), config.getTtl());
            return Optional.of(RefreshTrigger.TTL_EXPIRED);
        }

        if (config.isProbeEnabled() && claimProbe(now) && stalenessDetector.isStale(marker)) {
            return Optional.of(RefreshTrigger.STALENESS_DETECTED);
        }

        return Optional.empty();
    }

    /**
     * Lets exactly one caller probe per probe interval.
     */
    private boolean claimProbe(Instant now) {
        Instant last = lastProbeAt.get();
        if (last != null && last.plus(config.getProbeInterval()).isAfter(now)) {
            return false;
        }
        return lastProbeAt.compareAndSet(last, now);
    }

    /**
     * @return empty if another rebuild holds the lock
     */
    private Optional<RefreshResult> tryRebuild(RefreshTrigger trigger) {
        if (!rebuildLock.tryLock()) {
            skippedRebuilds.incrementAndGet();
            logger.debug("Rebuild ({}) skipped, another rebuild is in progress", trigger);
            return Optional.empty();
        }

        Instant takenAt = clock.instant();
        try {
            logger.info("Rebuilding schedule snapshot ({})", trigger);

            // Fingerprint before the scan: a change in between only causes one extra rebuild
            StalenessMarker observed = stalenessDetector.probe().orElse(null);
            List<ScheduleEntry> entries = scheduleReader.scanAll();
            CachedSnapshot snapshot = CachedSnapshot.partition(takenAt, entries);

            if (!partitionCache.publish(snapshot)) {
                // Marker stays behind so the next probe still sees the change
                CachedSnapshot served = partitionCache.read();
                logger.warn("Rebuild ({}) at {} superseded by snapshot taken at {}",
                        trigger, takenAt, served.takenAt());
                return Optional.of(RefreshResult.superseded(served));
            }

            marker = observed;
            lastProbeAt.set(takenAt);
            rebuilds.incrementAndGet();

            logger.info("Schedule snapshot rebuilt at {}: {} previous, {} now, {} up next",
                    takenAt, snapshot.previous().size(), snapshot.now().size(), snapshot.upNext().size());
            recordRefresh(snapshot);
            return Optional.of(RefreshResult.refreshed(snapshot));

        } catch (RuntimeException e) {
            failedRebuilds.incrementAndGet();
            StorageUnavailableException failure = e instanceof StorageUnavailableException storageError
                    ? storageError
                    : new StorageUnavailableException("Schedule rebuild failed", e);
            logger.error("Schedule snapshot rebuild ({}) failed, keeping the previous snapshot", trigger, e);
            recordFailure(takenAt, failure);
            partitionCache.failFirstLoad(failure);
            throw failure;

        } finally {
            rebuildLock.unlock();
        }
    }

    private void recordRefresh(CachedSnapshot snapshot) {
        try {
            metadataService.recordRefresh(snapshot.takenAt(), snapshot.size());
        } catch (RuntimeException e) {
            logger.warn("Failed to record rebuild metadata: {}", e.getMessage());
        }
    }

    private void recordFailure(Instant attemptedAt, StorageUnavailableException failure) {
        try {
            metadataService.recordFailure(attemptedAt, failure.reason());
        } catch (RuntimeException e) {
            logger.warn("Failed to record rebuild failure: {}", e.getMessage());
        }
    }
}
