package com.chuntfm.schedule.infrastructure.web.dto;

public record ErrorResponse(
        String code,
        String message,
        String details,
        String traceId
) {}
