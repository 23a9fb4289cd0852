package com.raceintel.racedata.output;

import com.raceintel.racedata.exception.ImportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Creates the race data schema. Every statement is idempotent, so this runs on each startup.
 *
 * Tables are created parents first (vehicles before anything that references it).
 * schema_version gates future migrations: a store written by a newer schema is refused.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    private final JdbcTemplate jdbcTemplate;

    private static final List<String> TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS vehicles (
                vehicle_id   TEXT PRIMARY KEY,
                car_number   INTEGER UNIQUE,
                class        TEXT,
                fastest_lap  REAL,
                average_lap  REAL,
                total_laps   INTEGER,
                max_speed    REAL,
                position     INTEGER
            )""",
            """
            CREATE TABLE IF NOT EXISTS lap_times (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                vehicle_id  TEXT NOT NULL REFERENCES vehicles(vehicle_id),
                lap         INTEGER NOT NULL,
                lap_time    REAL NOT NULL,
                timestamp   TEXT
            )""",
            """
            CREATE TABLE IF NOT EXISTS telemetry (
                id               INTEGER PRIMARY KEY AUTOINCREMENT,
                vehicle_id       TEXT NOT NULL REFERENCES vehicles(vehicle_id),
                lap              INTEGER,
                timestamp        TEXT NOT NULL,
                telemetry_name   TEXT NOT NULL,
                telemetry_value  REAL NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS race_results (
                vehicle_id     TEXT PRIMARY KEY REFERENCES vehicles(vehicle_id),
                position       INTEGER NOT NULL,
                car_number     INTEGER NOT NULL,
                laps           INTEGER NOT NULL,
                total_time     TEXT,
                gap_first      TEXT,
                gap_previous   TEXT,
                best_lap_time  TEXT,
                class          TEXT
            )""",
            """
            CREATE TABLE IF NOT EXISTS section_times (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                vehicle_id  TEXT NOT NULL REFERENCES vehicles(vehicle_id),
                lap         INTEGER NOT NULL,
                s1          REAL,
                s2          REAL,
                s3          REAL,
                lap_time    REAL,
                top_speed   REAL
            )""",
            """
            CREATE TABLE IF NOT EXISTS weather (
                id              INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp       TEXT NOT NULL,
                air_temp        REAL,
                track_temp      REAL,
                humidity        REAL,
                pressure        REAL,
                wind_speed      REAL,
                wind_direction  REAL,
                rain            REAL
            )""",
            """
            CREATE TABLE IF NOT EXISTS schema_version (
                version     INTEGER PRIMARY KEY,
                applied_at  TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS import_runs (
                run_id           TEXT PRIMARY KEY,
                file_name        TEXT NOT NULL,
                source_type      TEXT NOT NULL,
                checksum         TEXT,
                started_at       TEXT NOT NULL,
                completed_at     TEXT,
                status           TEXT NOT NULL,
                records_parsed   INTEGER NOT NULL DEFAULT 0,
                records_skipped  INTEGER NOT NULL DEFAULT 0,
                records_written  INTEGER NOT NULL DEFAULT 0,
                error_message    TEXT
            )"""
    );

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_vehicles_class ON vehicles(class)",
            "CREATE INDEX IF NOT EXISTS idx_vehicles_fastest_lap ON vehicles(fastest_lap)",
            "CREATE INDEX IF NOT EXISTS idx_lap_times_vehicle ON lap_times(vehicle_id, lap)",
            "CREATE INDEX IF NOT EXISTS idx_lap_times_time ON lap_times(lap_time)",
            // keyset replay reads (vehicle_id, timestamp, id) in order
            "CREATE INDEX IF NOT EXISTS idx_telemetry_replay ON telemetry(vehicle_id, timestamp, id)",
            "CREATE INDEX IF NOT EXISTS idx_telemetry_lap ON telemetry(vehicle_id, lap)",
            "CREATE INDEX IF NOT EXISTS idx_telemetry_name ON telemetry(telemetry_name)",
            "CREATE INDEX IF NOT EXISTS idx_results_position ON race_results(position)",
            "CREATE INDEX IF NOT EXISTS idx_section_vehicle ON section_times(vehicle_id, lap)",
            "CREATE INDEX IF NOT EXISTS idx_weather_timestamp ON weather(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_import_runs_file ON import_runs(file_name, checksum, status)"
    );

    public void ensureSchema() {
        log.info("Ensuring race data schema exists...");

        TABLES.forEach(jdbcTemplate::execute);
        INDEXES.forEach(jdbcTemplate::execute);

        Integer stored = jdbcTemplate.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
        if (stored == null) {
            jdbcTemplate.update("INSERT INTO schema_version (version, applied_at) VALUES (?, ?)",
                    CURRENT_SCHEMA_VERSION, LocalDateTime.now().toString());
            log.info("Schema version {} recorded", CURRENT_SCHEMA_VERSION);
        } else if (stored > CURRENT_SCHEMA_VERSION) {
            throw new ImportException("Store has schema version " + stored
                    + " but this build only understands up to " + CURRENT_SCHEMA_VERSION);
        }

        log.info("Race data schema ready.");
    }

    public int schemaVersion() {
        Integer stored = jdbcTemplate.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
        return stored == null ? 0 : stored;
    }
}
