package com.chuntfm.schedule.domain.port.out;

import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.domain.model.StalenessMarker;

import java.time.Instant;
import java.util.List;

/**
 * Read-only port over the schedule store.
 * Every method reports storage failures as
 * {@link com.chuntfm.schedule.domain.exception.StorageUnavailableException}.
 */
public interface ScheduleReader {

    /**
     * Reads every row in one consistent query. Only used to rebuild the snapshot cache.
     */
    List<ScheduleEntry> scanAll();

    /**
     * Cheap freshness probe, much cheaper than {@link #scanAll()}.
     */
    StalenessMarker fingerprint();

    /**
     * Case-insensitive substring search on the payload's {@code title} and {@code description}.
     * An entry matches when either supplied term is found in its field.
     *
     * @param title term for the title field, or null
     * @param description term for the description field, or null
     */
    List<ScheduleEntry> search(String title, String description);

    /**
     * Entries overlapping {@code [from, to)}. When {@code from} equals {@code to} this is a
     * point query: entries with {@code start <= from <= stop}.
     */
    List<ScheduleEntry> rangeQuery(Instant from, Instant to);
}
