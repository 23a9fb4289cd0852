package com.raceintel.racedata.output;

import com.raceintel.racedata.model.ImportRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Persists {@link ImportRun} bookkeeping rows. Failure to record a run is logged, never fatal.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportRunRecorder {

    private final JdbcTemplate jdbcTemplate;

    public void record(ImportRun run) {
        try {
            jdbcTemplate.update("""
                    INSERT OR REPLACE INTO import_runs
                    (run_id, file_name, source_type, checksum, started_at, completed_at,
                     status, records_parsed, records_skipped, records_written, error_message)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                    run.getRunId(),
                    run.getFileName(),
                    run.getSourceType().name(),
                    run.getChecksum(),
                    str(run.getStartedAt()),
                    str(run.getCompletedAt()),
                    run.getStatus().name(),
                    run.getRecordsParsed(),
                    run.getRecordsSkipped(),
                    run.getRecordsWritten(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write import run for {}: {}", run.getFileName(), e.getMessage());
        }
    }

    /** Whether this exact file content has already been imported successfully. */
    public boolean alreadyImported(String fileName, String checksum) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM import_runs
                WHERE file_name = ? AND checksum = ? AND status = 'SUCCESS'""",
                Integer.class, fileName, checksum);
        return count != null && count > 0;
    }

    private String str(LocalDateTime val) {
        return val == null ? null : val.toString();
    }
}
