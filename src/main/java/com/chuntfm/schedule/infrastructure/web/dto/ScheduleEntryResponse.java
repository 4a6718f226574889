package com.chuntfm.schedule.infrastructure.web.dto;

import com.chuntfm.schedule.domain.model.ScheduleEntry;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a schedule entry: {@code id}, {@code start}, {@code stop} followed by the payload keys.
 * Payload keys named like a structural field are dropped.
 */
public final class ScheduleEntryResponse {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private ScheduleEntryResponse() {
    }

    public static List<Map<String, Object>> fromEntries(List<ScheduleEntry> entries) {
        return entries.stream()
                .map(ScheduleEntryResponse::fromEntry)
                .toList();
    }

    public static Map<String, Object> fromEntry(ScheduleEntry entry) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", entry.id());
        body.put("start", formatTimestamp(entry.start()));
        body.put("stop", formatTimestamp(entry.stop()));
        entry.payload().forEach(body::putIfAbsent);
        return body;
    }

    public static String formatTimestamp(OffsetDateTime timestamp) {
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC).format(TIMESTAMP);
    }
}
