package com.chuntfm.schedule.infrastructure.cache;

import com.chuntfm.schedule.domain.exception.StorageUnavailableException;
import com.chuntfm.schedule.domain.model.CachedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published schedule snapshot.
 * Reads are a single volatile load and never wait for a rebuild.
 */
@Component
public class PartitionCache {

    private static final Logger logger = LoggerFactory.getLogger(PartitionCache.class);

    private final AtomicReference<CachedSnapshot> published = new AtomicReference<>();
    // Completed by the first publication, or failed and replaced when an initial load attempt fails
    private final AtomicReference<CompletableFuture<CachedSnapshot>> firstLoadAttempt =
            new AtomicReference<>(new CompletableFuture<>());

    /**
     * @return the published snapshot, or null if nothing has been published yet
     */
    public CachedSnapshot read() {
        return published.get();
    }

    /**
     * Atomically replaces the published snapshot.
     * A snapshot older than the one already published is ignored.
     *
     * @return true if {@code snapshot} is now the published one
     */
    public boolean publish(CachedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        CachedSnapshot winner = published.accumulateAndGet(snapshot, PartitionCache::newer);
        firstLoadAttempt.get().complete(winner);

        if (winner != snapshot) {
            logger.warn("Ignoring snapshot taken at {}: snapshot taken at {} is already published",
                    snapshot.takenAt(), winner.takenAt());
            return false;
        }

        logger.debug("Published snapshot taken at {} ({} previous, {} now, {} up next)",
                snapshot.takenAt(), snapshot.previous().size(), snapshot.now().size(), snapshot.upNext().size());
        return true;
    }

    /**
     * @return the initial load attempt that readers arriving now should wait for
     */
    CompletableFuture<CachedSnapshot> pendingFirstLoad() {
        return firstLoadAttempt.get();
    }

    /**
     * Releases readers waiting on the current initial load attempt with {@code failure}.
     * Does nothing once a snapshot has been published.
     */
    void failFirstLoad(StorageUnavailableException failure) {
        if (published.get() != null) {
            return;
        }
        CompletableFuture<CachedSnapshot> attempt = firstLoadAttempt.getAndSet(new CompletableFuture<>());
        attempt.completeExceptionally(failure);
    }

    /**
     * Waits until a first snapshot exists, or the timeout elapses.
     */
    public Optional<CachedSnapshot> awaitFirstPublication(Duration timeout) {
        return awaitFirstPublication(pendingFirstLoad(), timeout);
    }

    /**
     * Waits for {@code attempt} to publish a first snapshot, or the timeout to elapse.
     *
     * @throws StorageUnavailableException as soon as the attempt fails
     */
    Optional<CachedSnapshot> awaitFirstPublication(CompletableFuture<CachedSnapshot> attempt, Duration timeout) {
        CachedSnapshot current = published.get();
        if (current != null) {
            return Optional.of(current);
        }
        try {
            attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("No schedule snapshot published within {}", timeout);
        } catch (ExecutionException e) {
            current = published.get();
            if (current != null) {
                return Optional.of(current);
            }
            throw new StorageUnavailableException("Initial schedule load failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the first schedule snapshot");
        }
        return Optional.ofNullable(published.get());
    }

    private static CachedSnapshot newer(CachedSnapshot current, CachedSnapshot candidate) {
        if (current == null || !candidate.takenAt().isBefore(current.takenAt())) {
            return candidate;
        }
        return current;
    }
}
