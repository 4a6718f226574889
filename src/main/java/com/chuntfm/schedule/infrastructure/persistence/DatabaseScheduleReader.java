package com.chuntfm.schedule.infrastructure.persistence;

import com.chuntfm.schedule.domain.exception.StorageUnavailableException;
import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.domain.model.StalenessMarker;
import com.chuntfm.schedule.domain.port.out.ScheduleReader;
import com.chuntfm.schedule.infrastructure.adapter.mapper.SchedulePayloadMapper;
import com.chuntfm.schedule.infrastructure.cache.ScheduleCacheConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only JDBC access to the {@code schedule} table.
 */
@Repository
public class DatabaseScheduleReader implements ScheduleReader {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseScheduleReader.class);

    static final String STORAGE = "schedule-storage";

    private static final String SELECT_ENTRIES = "SELECT id, start, stop, data FROM schedule";

    private final JdbcTemplate jdbcTemplate;
    private final SchedulePayloadMapper payloadMapper;
    private final String fingerprintSql;
    private final boolean tracksModification;

    public DatabaseScheduleReader(JdbcTemplate jdbcTemplate,
                                  SchedulePayloadMapper payloadMapper,
                                  ScheduleCacheConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.payloadMapper = payloadMapper;
        this.tracksModification = !config.getModifiedColumns().isEmpty();
        this.fingerprintSql = buildFingerprintSql(config.getModifiedColumns());
    }

    @Override
    @Retry(name = STORAGE)
    @CircuitBreaker(name = STORAGE)
    public List<ScheduleEntry> scanAll() {
        String sql = SELECT_ENTRIES + " ORDER BY start, id";

        try {
            List<ScheduleEntry> entries = query(sql);
            logger.debug("Full scan returned {} schedule entries", entries.size());
            return entries;
        } catch (DataAccessException e) {
            logger.error("Database error while scanning schedule", e);
            throw new StorageUnavailableException("Failed to scan schedule", e);
        }
    }

    @Override
    public StalenessMarker fingerprint() {
        try {
            return jdbcTemplate.queryForObject(fingerprintSql, (rs, rowNum) -> new StalenessMarker(
                    rs.getLong("row_count"),
                    tracksModification ? toInstant(rs.getObject("last_modified", OffsetDateTime.class)) : null
            ));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read schedule fingerprint", e);
        }
    }

    @Override
    @Retry(name = STORAGE)
    @CircuitBreaker(name = STORAGE)
    public List<ScheduleEntry> search(String title, String description) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        // Coarse filter on the raw JSON text, refined on the parsed payload below
        if (title != null) {
            conditions.add("data ILIKE ?");
            params.add(containsPattern(title));
        }
        if (description != null) {
            conditions.add("data ILIKE ?");
            params.add(containsPattern(description));
        }
        if (conditions.isEmpty()) {
            return List.of();
        }

        String sql = SELECT_ENTRIES + " WHERE " + String.join(" OR ", conditions) + " ORDER BY start, id";

        try {
            List<ScheduleEntry> matches = query(sql, params.toArray()).stream()
                    .filter(entry -> entry.fieldContains("title", title)
                            || entry.fieldContains("description", description))
                    .toList();
            logger.debug("Search title={} description={} matched {} entries", title, description, matches.size());
            return matches;
        } catch (DataAccessException e) {
            logger.error("Database error while searching schedule", e);
            throw new StorageUnavailableException("Failed to search schedule", e);
        }
    }

    @Override
    @Retry(name = STORAGE)
    @CircuitBreaker(name = STORAGE)
    public List<ScheduleEntry> rangeQuery(Instant from, Instant to) {
        OffsetDateTime fromTs = from.atOffset(ZoneOffset.UTC);
        OffsetDateTime toTs = to.atOffset(ZoneOffset.UTC);

        try {
            if (from.equals(to)) {
                return query(SELECT_ENTRIES + " WHERE start <= ? AND stop >= ? ORDER BY start, id", fromTs, fromTs);
            }
            // Entries overlapping the half-open range [from, to)
            return query(SELECT_ENTRIES + " WHERE start < ? AND stop >= ? ORDER BY start, id", toTs, fromTs);
        } catch (DataAccessException e) {
            logger.error("Database error while finding schedule between {} and {}", from, to, e);
            throw new StorageUnavailableException("Failed to query schedule range", e);
        }
    }

    private List<ScheduleEntry> query(String sql, Object... params) {
        return jdbcTemplate.query(sql, this::mapEntry, params).stream()
                .filter(Objects::nonNull)
                .toList();
    }

    private ScheduleEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        OffsetDateTime start = rs.getObject("start", OffsetDateTime.class);
        OffsetDateTime stop = rs.getObject("stop", OffsetDateTime.class);
        if (start == null || stop == null) {
            logger.warn("Skipping schedule row {} without start or stop", id);
            return null;
        }
        try {
            return new ScheduleEntry(id, start, stop, payloadMapper.toPayload(rs.getString("data")));
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping invalid schedule row {}: {}", id, e.getMessage());
            return null;
        }
    }

    private static String buildFingerprintSql(List<String> modifiedColumns) {
        if (modifiedColumns.isEmpty()) {
            return "SELECT COUNT(*) AS row_count FROM schedule";
        }
        String latest = modifiedColumns.size() == 1
                ? modifiedColumns.get(0)
                : "COALESCE(" + String.join(", ", modifiedColumns) + ")";
        return "SELECT COUNT(*) AS row_count, MAX(" + latest + ") AS last_modified FROM schedule";
    }

    private static String containsPattern(String term) {
        String escaped = term
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
