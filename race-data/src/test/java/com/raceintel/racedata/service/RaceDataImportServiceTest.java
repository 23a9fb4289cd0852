package com.raceintel.racedata.service;

import com.raceintel.racedata.StoreTestSupport;
import com.raceintel.racedata.config.RaceDataProperties;
import com.raceintel.racedata.exception.ImportException;
import com.raceintel.racedata.model.ImportSummary;
import com.raceintel.racedata.model.LapRow;
import com.raceintel.racedata.model.SourceType;
import com.raceintel.racedata.model.Vehicle;
import com.raceintel.racedata.output.ImportRunRecorder;
import com.raceintel.racedata.output.ReferentialLoader;
import com.raceintel.racedata.output.SchemaManager;
import com.raceintel.racedata.parser.CsvRow;
import com.raceintel.racedata.parser.LapTimeCsvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end import over a directory of CSV fixtures.
 *
 * Tests cover:
 * 1. Three laps and two telemetry rows for car 78
 * 2. Every source contributes its vehicles; no dangling references
 * 3. Unchanged files are skipped on re-import
 * 4. --force appends
 * 5. A failing file is rolled back and recorded as FAILED
 * 6. Unrecognised files are ignored
 * 7. A truncated lap time skips that row only
 * 8. An unexpected failure inside a file is still recorded as FAILED
 */
@SpringBootTest
@ActiveProfiles("test")
class RaceDataImportServiceTest {

    @Autowired
    private RaceDataImportService importService;

    @Autowired
    private AggregateStatisticsService statistics;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SourceFileScanner scanner;

    @Autowired
    private ReferentialLoader loader;

    @Autowired
    private ImportRunRecorder runRecorder;

    @Autowired
    private SchemaManager schemaManager;

    @Autowired
    private RaceDataProperties properties;

    @TempDir
    Path dataDir;

    @BeforeEach
    void setUp() {
        StoreTestSupport.clear(jdbcTemplate);
    }

    /**
     * Test 1: one vehicle, exact counts, fastest lap is the minimum
     */
    @Test
    void testSingleCarImport() throws IOException {
        writeLaps();
        writeTelemetry();

        ImportSummary summary = importService.importDirectory(dataDir, false);

        assertEquals(1, summary.getVehicles());
        assertEquals(3, summary.written(SourceType.LAP_TIMES));
        assertEquals(2, summary.written(SourceType.TELEMETRY));
        assertEquals(0, summary.getRowsSkipped());

        assertEquals(1, StoreTestSupport.count(jdbcTemplate, "vehicles"));
        assertEquals(3, StoreTestSupport.count(jdbcTemplate, "lap_times"));
        assertEquals(2, StoreTestSupport.count(jdbcTemplate, "telemetry"));

        Vehicle car = statistics.findVehicle("GR86-004-78").orElseThrow();
        assertEquals(78, car.getCarNumber());
        assertEquals(94_500.0, car.getFastestLap(), 0.01);
        assertEquals((95_123.0 + 94_500.0 + 96_010.0) / 3, car.getAverageLap(), 0.01);
        assertEquals(3, car.getTotalLaps());
        assertEquals(153.8, car.getMaxSpeed(), 0.01);
    }

    /**
     * Test 2: identity completeness across results, laps, sections and telemetry
     *
     * Car 13 appears only in results, 55 only in laps, 2 only in telemetry, 41 only in sections.
     * One result line has no car number and one telemetry line no resolvable vehicle.
     */
    @Test
    void testEverySourceContributesVehicles() throws IOException {
        StoreTestSupport.writeCsv(dataDir, "03_Results GR Cup Race 1.CSV",
                "POSITION;NUMBER;LAPS;TOTAL_TIME;GAP_FIRST;GAP_PREVIOUS;FL_TIME;CLASS",
                "1;78;3;4:45.633;-;-;1:34.500;Am",
                "2;13;3;4:47.100;+1.467;+1.467;1:35.000;Pro",
                "3;;3;;;;;Am");
        StoreTestSupport.writeCsv(dataDir, "R1_lap_time.csv",
                "vehicle_id,lap,value,timestamp",
                "GR86-004-78,1,95123,2025-04-27T14:00:00.000Z",
                "GR86-001-55,1,97000,2025-04-27T14:00:01.000Z");
        StoreTestSupport.writeCsv(dataDir, "R1_telemetry_data.csv",
                "vehicle_id,lap,timestamp,telemetry_name,telemetry_value",
                "GR86-004-2,1,2025-04-27T14:00:00.100Z,speed_can,149.0",
                "unknown,1,2025-04-27T14:00:00.200Z,speed_can,150.0");
        StoreTestSupport.writeCsv(dataDir, "23_AnalysisEnduranceWithSections_Race 1.CSV",
                "NUMBER;LAP_NUMBER;LAP_TIME;S1;S2;S3;TOP_SPEED",
                "41;1;1:36.000;32.0;32.0;32.0;158.0");

        ImportSummary summary = importService.importDirectory(dataDir, false);

        assertEquals(5, summary.getVehicles());
        assertEquals(2, summary.getRowsSkipped());
        assertEquals(5, StoreTestSupport.count(jdbcTemplate, "vehicles"));
        assertEquals(2, StoreTestSupport.count(jdbcTemplate, "race_results"));
        assertEquals(1, StoreTestSupport.count(jdbcTemplate, "section_times"));

        for (String table : new String[]{"lap_times", "telemetry", "race_results", "section_times"}) {
            Integer dangling = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE vehicle_id NOT IN (SELECT vehicle_id FROM vehicles)",
                    Integer.class);
            assertEquals(0, dangling, table);
        }

        Vehicle winner = statistics.findVehicle("GR86-004-78").orElseThrow();
        assertEquals(1, winner.getPosition());
        assertEquals("Am", winner.getVehicleClass());
        assertEquals(149.0, statistics.findVehicle("GR86-004-2").orElseThrow().getMaxSpeed(), 0.01);
    }

    /**
     * Test 3: identical content is not imported twice
     */
    @Test
    void testReimportSkipsUnchangedFiles() throws IOException {
        writeLaps();
        importService.importDirectory(dataDir, false);

        ImportSummary second = importService.importDirectory(dataDir, false);

        assertEquals(1, second.getFilesSkipped());
        assertEquals(0, second.getFilesImported());
        assertEquals(3, StoreTestSupport.count(jdbcTemplate, "lap_times"));

        Integer skippedRuns = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM import_runs WHERE status = 'SKIPPED'", Integer.class);
        assertEquals(1, skippedRuns);
    }

    /**
     * Test 4: forced re-import appends to the append-only tables
     */
    @Test
    void testForcedReimportAppends() throws IOException {
        writeLaps();
        importService.importDirectory(dataDir, false);

        ImportSummary forced = importService.importDirectory(dataDir, true);

        assertEquals(1, forced.getFilesImported());
        assertEquals(6, StoreTestSupport.count(jdbcTemplate, "lap_times"));
        assertEquals(1, StoreTestSupport.count(jdbcTemplate, "vehicles"));
        assertEquals(6, statistics.findVehicle("GR86-004-78").orElseThrow().getTotalLaps());
    }

    /**
     * Test 5: a results file naming the same car twice violates the key and aborts the run
     */
    @Test
    void testFailingFileRolledBackAndRecorded() throws IOException {
        StoreTestSupport.writeCsv(dataDir, "Results.csv",
                "POSITION;NUMBER;LAPS",
                "1;78;3",
                "2;78;3");
        writeLaps();

        assertThrows(ImportException.class, () -> importService.importDirectory(dataDir, false));

        assertEquals(0, StoreTestSupport.count(jdbcTemplate, "race_results"));
        assertEquals(0, StoreTestSupport.count(jdbcTemplate, "vehicles"));
        // results are imported first, so the lap file was never reached
        assertEquals(0, StoreTestSupport.count(jdbcTemplate, "lap_times"));

        String status = jdbcTemplate.queryForObject(
                "SELECT status FROM import_runs WHERE file_name = 'Results.csv'", String.class);
        assertEquals("FAILED", status);
    }

    /**
     * Test 6: files that match no source are left alone
     */
    @Test
    void testUnrecognisedFilesIgnored() throws IOException {
        writeLaps();
        StoreTestSupport.writeCsv(dataDir, "notes.csv", "a,b", "1,2");
        StoreTestSupport.writeCsv(dataDir, "lap_time_backup.txt", "vehicle_id,lap,value", "GR86-004-78,1,1");

        ImportSummary summary = importService.importDirectory(dataDir, false);

        assertEquals(1, summary.getFilesImported());
        assertEquals(3, StoreTestSupport.count(jdbcTemplate, "lap_times"));
    }

    /**
     * Test 7: a lap value cut off after the colon is dropped, the rest of the file loads
     */
    @Test
    void testTruncatedLapTimeSkipsRow() throws IOException {
        StoreTestSupport.writeCsv(dataDir, "R1_lap_time.csv",
                "vehicle_id,lap,value",
                "GR86-004-78,1,95123",
                "GR86-004-78,2,1:",
                "GR86-004-78,3,96000");

        ImportSummary summary = importService.importDirectory(dataDir, false);

        assertEquals(2, summary.written(SourceType.LAP_TIMES));
        assertEquals(1, summary.getRowsSkipped());
        assertEquals(2, StoreTestSupport.count(jdbcTemplate, "lap_times"));

        Map<String, Object> run = jdbcTemplate.queryForMap(
                "SELECT status, records_skipped FROM import_runs WHERE file_name = 'R1_lap_time.csv'");
        assertEquals("SUCCESS", run.get("status"));
        assertEquals(1, ((Number) run.get("records_skipped")).intValue());
    }

    /**
     * Test 8: a failure that is not an import error still marks the run FAILED
     */
    @Test
    void testUnexpectedFailureRecordedAsFailed() throws IOException {
        LapTimeCsvParser broken = new LapTimeCsvParser() {
            @Override
            protected LapRow mapRow(CsvRow row) {
                throw new IllegalStateException("lap decoder unavailable");
            }
        };
        RaceDataImportService service = new RaceDataImportService(scanner, List.of(broken), loader,
                runRecorder, schemaManager, statistics, properties);
        writeLaps();

        ImportException e = assertThrows(ImportException.class, () -> service.importDirectory(dataDir, false));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("R1_lap_time.csv"));

        Map<String, Object> run = jdbcTemplate.queryForMap(
                "SELECT status, error_message FROM import_runs WHERE file_name = 'R1_lap_time.csv'");
        assertEquals("FAILED", run.get("status"));
        assertTrue(((String) run.get("error_message")).contains("lap decoder unavailable"));
        assertEquals(0, StoreTestSupport.count(jdbcTemplate, "lap_times"));
    }

    private void writeLaps() throws IOException {
        StoreTestSupport.writeCsv(dataDir, "R1_lap_time.csv",
                "vehicle_id,lap,value,timestamp",
                "GR86-004-78,1,95123,2025-04-27T14:00:00.000Z",
                "GR86-004-78,2,94500,2025-04-27T14:01:35.000Z",
                "GR86-004-78,3,96010,2025-04-27T14:03:10.000Z");
    }

    private void writeTelemetry() throws IOException {
        StoreTestSupport.writeCsv(dataDir, "R1_telemetry_data.csv",
                "vehicle_id,lap,timestamp,telemetry_name,telemetry_value",
                "GR86-004-78,1,2025-04-27T14:00:00.100Z,vCar,152.3",
                "GR86-004-78,1,2025-04-27T14:00:00.200Z,vCar,153.8");
    }
}
