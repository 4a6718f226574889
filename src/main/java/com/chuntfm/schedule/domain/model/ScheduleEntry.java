package com.chuntfm.schedule.domain.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single row of the schedule table.
 * The payload is the parsed JSON document stored alongside the slot; its keys never
 * replace {@code id}, {@code start} or {@code stop}.
 */
public record ScheduleEntry(
        long id,
        OffsetDateTime start,
        OffsetDateTime stop,
        Map<String, Object> payload
) {

    public ScheduleEntry {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stop, "stop");
        if (start.isAfter(stop)) {
            throw new IllegalArgumentException(
                    "Schedule entry " + id + " starts after it stops: " + start + " > " + stop);
        }
        // LinkedHashMap keeps JSON key order and tolerates null values
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Text value of a payload field, if present and not null.
     */
    public Optional<String> textField(String key) {
        Object value = payload.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    /**
     * Case-insensitive substring match against a payload field.
     */
    public boolean fieldContains(String key, String term) {
        if (term == null) {
            return false;
        }
        String needle = term.toLowerCase(Locale.ROOT);
        return textField(key)
                .map(value -> value.toLowerCase(Locale.ROOT).contains(needle))
                .orElse(false);
    }
}
