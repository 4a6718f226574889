package com.chuntfm.schedule.domain.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one full scan, split into the three time partitions
 * against a single reference instant.
 *
 * <ul>
 *   <li>{@code previous}: {@code stop < takenAt}, latest stop first</li>
 *   <li>{@code now}: {@code start <= takenAt <= stop}, earliest start first</li>
 *   <li>{@code upNext}: {@code start > takenAt}, earliest start first</li>
 * </ul>
 * Ties are broken by ascending id.
 */
public record CachedSnapshot(
        Instant takenAt,
        List<ScheduleEntry> previous,
        List<ScheduleEntry> now,
        List<ScheduleEntry> upNext
) {

    static final Comparator<ScheduleEntry> LATEST_STOP_FIRST =
            Comparator.comparing(ScheduleEntry::stop, OffsetDateTime.timeLineOrder().reversed())
                    .thenComparingLong(ScheduleEntry::id);

    static final Comparator<ScheduleEntry> EARLIEST_START_FIRST =
            Comparator.comparing(ScheduleEntry::start, OffsetDateTime.timeLineOrder())
                    .thenComparingLong(ScheduleEntry::id);

    public CachedSnapshot {
        Objects.requireNonNull(takenAt, "takenAt");
        previous = List.copyOf(previous);
        now = List.copyOf(now);
        upNext = List.copyOf(upNext);
    }

    /**
     * Partitions a full scan against {@code takenAt}. Every entry lands in exactly one partition.
     */
    public static CachedSnapshot partition(Instant takenAt, Collection<ScheduleEntry> entries) {
        List<ScheduleEntry> previous = new ArrayList<>();
        List<ScheduleEntry> now = new ArrayList<>();
        List<ScheduleEntry> upNext = new ArrayList<>();

        for (ScheduleEntry entry : entries) {
            if (entry.stop().toInstant().isBefore(takenAt)) {
                previous.add(entry);
            } else if (entry.start().toInstant().isAfter(takenAt)) {
                upNext.add(entry);
            } else {
                now.add(entry);
            }
        }

        previous.sort(LATEST_STOP_FIRST);
        now.sort(EARLIEST_START_FIRST);
        upNext.sort(EARLIEST_START_FIRST);

        return new CachedSnapshot(takenAt, previous, now, upNext);
    }

    public int size() {
        return previous.size() + now.size() + upNext.size();
    }
}
