package com.chuntfm.schedule.infrastructure.persistence;

import com.chuntfm.schedule.domain.model.ScheduleEntry;
import com.chuntfm.schedule.domain.model.StalenessMarker;
import com.chuntfm.schedule.infrastructure.adapter.mapper.SchedulePayloadMapper;
import com.chuntfm.schedule.infrastructure.cache.ScheduleCacheConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class DatabaseScheduleReaderIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("chuntfm_test")
                    .withUsername("test")
                    .withPassword("test");

    private static HikariDataSource dataSource;
    private static JdbcTemplate jdbcTemplate;
    private static DatabaseScheduleReader reader;

    @BeforeAll
    static void setup() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        dataSource = new HikariDataSource(config);

        jdbcTemplate = new JdbcTemplate(dataSource);

        // V1__Create_schedule_table.sql
        Flyway.configure().dataSource(dataSource).load().migrate();

        reader = new DatabaseScheduleReader(jdbcTemplate,
                new SchedulePayloadMapper(new ObjectMapper()), new ScheduleCacheConfig());
    }

    @AfterAll
    static void closeDataSource() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void cleanup() {
        jdbcTemplate.execute("DELETE FROM schedule");
    }

    @Test
    void shouldScanAllEntries() {
        // Given
        long a = insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "{\"title\":\"A\"}");
        long b = insert("2023-01-01T11:30:00Z", "2023-01-01T12:30:00Z", "{\"title\":\"B\",\"hosts\":[\"Ana\"]}");

        // When
        List<ScheduleEntry> entries = reader.scanAll();

        // Then
        assertThat(entries).extracting(ScheduleEntry::id).containsExactly(a, b);
        assertThat(entries.get(0).start().toInstant()).isEqualTo(Instant.parse("2023-01-01T11:00:00Z"));
        assertThat(entries.get(1).payload()).containsEntry("hosts", List.of("Ana"));
    }

    @Test
    void shouldKeepUnparsableDataAsRawText() {
        // Given
        insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "plain text slot");

        // When
        List<ScheduleEntry> entries = reader.scanAll();

        // Then
        assertThat(entries).singleElement()
                .satisfies(e -> assertThat(e.payload()).containsEntry(SchedulePayloadMapper.RAW_DATA_KEY, "plain text slot"));
    }

    @Test
    void shouldSkipRowsThatCannotFormAnEntry() {
        // Given - relax the table so it can hold rows a migrated schema would reject
        jdbcTemplate.execute("ALTER TABLE schedule ALTER COLUMN stop DROP NOT NULL");
        jdbcTemplate.execute("ALTER TABLE schedule DROP CONSTRAINT schedule_start_before_stop");
        try {
            long valid = insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "{\"title\":\"A\"}");
            jdbcTemplate.update("INSERT INTO schedule (start, stop, data) VALUES (?, NULL, ?)",
                    OffsetDateTime.parse("2023-01-01T12:00:00Z"), "{\"title\":\"No stop\"}");
            insert("2023-01-01T14:00:00Z", "2023-01-01T13:00:00Z", "{\"title\":\"Reversed\"}");

            // When
            List<ScheduleEntry> entries = reader.scanAll();

            // Then
            assertThat(entries).extracting(ScheduleEntry::id).containsExactly(valid);
        } finally {
            jdbcTemplate.execute("DELETE FROM schedule");
            jdbcTemplate.execute("ALTER TABLE schedule ALTER COLUMN stop SET NOT NULL");
            jdbcTemplate.execute("ALTER TABLE schedule ADD CONSTRAINT schedule_start_before_stop CHECK (start <= stop)");
        }
    }

    @Test
    void shouldReturnEmptyScanForEmptyTable() {
        assertThat(reader.scanAll()).isEmpty();
        assertThat(reader.fingerprint()).isEqualTo(new StalenessMarker(0, null));
    }

    @Test
    void shouldChangeFingerprintOnInsertUpdateAndDelete() {
        // Given
        long id = insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "{\"title\":\"A\"}");
        StalenessMarker afterInsert = reader.fingerprint();

        // When
        jdbcTemplate.update("UPDATE schedule SET data = ? WHERE id = ?", "{\"title\":\"A2\"}", id);
        StalenessMarker afterUpdate = reader.fingerprint();
        insert("2023-01-01T12:00:00Z", "2023-01-01T13:00:00Z", "{\"title\":\"B\"}");
        jdbcTemplate.update("DELETE FROM schedule WHERE id = ?", id);
        StalenessMarker afterDelete = reader.fingerprint();

        // Then
        assertThat(afterInsert.rowCount()).isEqualTo(1);
        assertThat(afterInsert.lastModified()).isNotNull();
        assertThat(afterUpdate).isNotEqualTo(afterInsert);
        assertThat(afterUpdate.lastModified()).isAfter(afterInsert.lastModified());
        assertThat(afterDelete).isNotEqualTo(afterUpdate);
        assertThat(reader.fingerprint()).isEqualTo(afterDelete);
    }

    @Test
    void shouldProbeRowCountOnlyWithoutModificationColumns() {
        // Given
        ScheduleCacheConfig countOnly = new ScheduleCacheConfig();
        countOnly.setModifiedColumns(List.of());
        DatabaseScheduleReader countingReader = new DatabaseScheduleReader(jdbcTemplate,
                new SchedulePayloadMapper(new ObjectMapper()), countOnly);
        insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "{}");

        // When & Then
        assertThat(countingReader.fingerprint()).isEqualTo(new StalenessMarker(1, null));
    }

    @Test
    void shouldSearchTitleAndDescriptionCaseInsensitively() {
        // Given
        insert("2023-01-01T08:00:00Z", "2023-01-01T09:00:00Z", "{\"title\":\"Morning NEWS\",\"description\":\"Headlines\"}");
        insert("2023-01-01T09:00:00Z", "2023-01-01T10:00:00Z", "{\"title\":\"Jazz Hour\",\"description\":\"Late news recap\"}");
        insert("2023-01-01T10:00:00Z", "2023-01-01T11:00:00Z", "{\"title\":\"Ambient\",\"description\":\"Quiet\",\"tags\":\"news\"}");

        // When & Then
        assertThat(reader.search("news", null)).extracting(e -> e.payload().get("title"))
                .containsExactly("Morning NEWS");
        assertThat(reader.search(null, "NEWS")).extracting(e -> e.payload().get("title"))
                .containsExactly("Jazz Hour");
        assertThat(reader.search("news", "news")).extracting(e -> e.payload().get("title"))
                .containsExactly("Morning NEWS", "Jazz Hour");
    }

    @Test
    void shouldTreatWildcardsLiterally() {
        // Given
        insert("2023-01-01T08:00:00Z", "2023-01-01T09:00:00Z", "{\"title\":\"100% Jazz\"}");
        insert("2023-01-01T09:00:00Z", "2023-01-01T10:00:00Z", "{\"title\":\"1000 Jazz\"}");
        insert("2023-01-01T10:00:00Z", "2023-01-01T11:00:00Z", "{\"title\":\"Drum and bass\"}");

        // When & Then
        assertThat(reader.search("100%", null)).extracting(e -> e.payload().get("title"))
                .containsExactly("100% Jazz");
        assertThat(reader.search("m_a", null)).isEmpty();
    }

    @Test
    void shouldFindEntriesAtInstantInclusively() {
        // Given
        insert("2023-01-01T11:00:00Z", "2023-01-01T11:30:00Z", "{\"title\":\"A\"}");
        insert("2023-01-01T11:30:00Z", "2023-01-01T12:30:00Z", "{\"title\":\"B\"}");
        insert("2023-01-01T13:00:00Z", "2023-01-01T14:00:00Z", "{\"title\":\"C\"}");
        Instant at = Instant.parse("2023-01-01T11:30:00Z");

        // When
        List<ScheduleEntry> entries = reader.rangeQuery(at, at);

        // Then
        assertThat(entries).extracting(e -> e.payload().get("title")).containsExactly("A", "B");
    }

    @Test
    void shouldFindEntriesOverlappingRange() {
        // Given
        insert("2022-12-31T23:00:00Z", "2023-01-01T01:00:00Z", "{\"title\":\"Overnight\"}");
        insert("2023-01-01T11:30:00Z", "2023-01-01T12:30:00Z", "{\"title\":\"Midday\"}");
        insert("2023-01-02T00:00:00Z", "2023-01-02T01:00:00Z", "{\"title\":\"Next day\"}");
        insert("2022-12-31T20:00:00Z", "2022-12-31T22:00:00Z", "{\"title\":\"Day before\"}");

        // When
        List<ScheduleEntry> entries = reader.rangeQuery(
                Instant.parse("2023-01-01T00:00:00Z"), Instant.parse("2023-01-02T00:00:00Z"));

        // Then
        assertThat(entries).extracting(e -> e.payload().get("title")).containsExactly("Overnight", "Midday");
    }

    private long insert(String start, String stop, String data) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO schedule (start, stop, data) VALUES (?, ?, ?) RETURNING id",
                Long.class, OffsetDateTime.parse(start), OffsetDateTime.parse(stop), data);
        return id != null ? id : -1;
    }
}
