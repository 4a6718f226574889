package com.chuntfm.schedule.application;

import com.chuntfm.schedule.domain.exception.InvalidQueryException;
import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.domain.port.out.ScheduleReader;
import com.chuntfm.schedule.domain.port.out.ScheduleSnapshots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

@Service
public class ScheduleUseCase implements FindSchedule {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleUseCase.class);

    private final ScheduleSnapshots snapshots;
    private final ScheduleReader scheduleReader;
    private final ZoneId referenceZone;

    public ScheduleUseCase(ScheduleSnapshots snapshots,
                           ScheduleReader scheduleReader,
                           @Value("${chuntfm.schedule.reference-zone:UTC}") String referenceZone) {
        this.snapshots = snapshots;
        this.scheduleReader = scheduleReader;
        this.referenceZone = ZoneId.of(referenceZone);
    }

    @Override
    public List<ScheduleEntry> previous() {
        return snapshots.current().previous();
    }

    @Override
    public List<ScheduleEntry> now() {
        return snapshots.current().now();
    }

    @Override
    public List<ScheduleEntry> upNext() {
        return snapshots.current().upNext();
    }

    @Override
    public List<ScheduleEntry> when(String title, String description) {
        String titleTerm = normalize(title);
        String descriptionTerm = normalize(description);

        if (titleTerm == null && descriptionTerm == null) {
            throw new InvalidQueryException("Either title or description must be provided");
        }

        logger.debug("Searching schedule for title={} description={}", titleTerm, descriptionTerm);
        return scheduleReader.search(titleTerm, descriptionTerm);
    }

    @Override
    public List<ScheduleEntry> what(String time) {
        String value = normalize(time);
        if (value == null) {
            throw new InvalidQueryException("A time must be provided");
        }

        LocalDate day = parseDay(value);
        if (day != null) {
            // Whole day: [start of day, start of next day) in the reference zone
            Instant from = day.atStartOfDay(referenceZone).toInstant();
            Instant to = day.plusDays(1).atStartOfDay(referenceZone).toInstant();
            logger.debug("Finding schedule for day {} ({} to {})", day, from, to);
            return scheduleReader.rangeQuery(from, to);
        }

        Instant instant = parseInstant(value);
        logger.debug("Finding schedule at {}", instant);
        return scheduleReader.rangeQuery(instant, instant);
    }

    private LocalDate parseDay(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Instant parseInstant(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(value).atZone(referenceZone).toInstant();
            } catch (DateTimeParseException e) {
                throw new InvalidQueryException(
                        "Invalid time format '" + value + "'. Use an ISO 8601 date or date-time", e);
            }
        }
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
