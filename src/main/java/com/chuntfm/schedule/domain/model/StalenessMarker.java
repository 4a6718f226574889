package com.chuntfm.schedule.domain.model;

import java.time.Instant;

/**
 * Cheap storage fingerprint: row count and the latest modification timestamp
 * ({@code lastModified} is null when no modification columns are configured or the table is empty).
 */
public record StalenessMarker(
        long rowCount,
        Instant lastModified
) {}
