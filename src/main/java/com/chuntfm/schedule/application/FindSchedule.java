package com.chuntfm.schedule.application;

import com.chuntfm.schedule.domain.model.ScheduleEntry;

import java.util.List;

/**
 * Read queries over the radio schedule.
 * The three time partitions are served from the snapshot cache; {@code when} and {@code what}
 * always query storage.
 */
public interface FindSchedule {

    /**
     * Slots that have already finished, most recently finished first.
     */
    List<ScheduleEntry> previous();

    /**
     * Slots on air at the snapshot instant.
     */
    List<ScheduleEntry> now();

    /**
     * Slots that have not started yet, soonest first.
     */
    List<ScheduleEntry> upNext();

    /**
     * Free-text search on title and description. At least one term is required.
     *
     * @param title case-insensitive title term, may be null or blank
     * @param description case-insensitive description term, may be null or blank
     * @throws com.chuntfm.schedule.domain.exception.InvalidQueryException if both terms are missing
     */
    List<ScheduleEntry> when(String title, String description);

    /**
     * Slots scheduled at an instant ({@code 2023-01-01T12:00:00Z}) or during a whole day
     * ({@code 2023-01-01}) in the reference time zone.
     *
     * @throws com.chuntfm.schedule.domain.exception.InvalidQueryException if {@code time} cannot be parsed
     */
    List<ScheduleEntry> what(String time);
}
