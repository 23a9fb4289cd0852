package com.raceintel.racedata.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each source file import for observability and idempotency.
 * Stored in the import_runs table.
 */
@Data
@Builder
public class ImportRun {

    private String runId;           // UUID
    private String fileName;
    private SourceType sourceType;
    private String checksum;        // SHA-256 of the file content, hex
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private int recordsParsed;
    private int recordsSkipped;
    private int recordsWritten;
    private String errorMessage;    // null on success

    public enum Status {
        RUNNING, SUCCESS, FAILED, SKIPPED
    }
}
