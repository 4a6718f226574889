package com.chuntfm.schedule.infrastructure.web.dto;

import com.chuntfm.schedule.domain.model.RefreshResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneOffset;

public record CacheRefreshResponse(
        String status,
        @JsonProperty("taken_at") String takenAt,
        int entries
) {
    public static CacheRefreshResponse fromResult(RefreshResult result) {
        String takenAt = result.takenAt() != null
                ? ScheduleEntryResponse.formatTimestamp(result.takenAt().atOffset(ZoneOffset.UTC))
                : null;
        return new CacheRefreshResponse(result.status().name(), takenAt, result.entryCount());
    }
}
