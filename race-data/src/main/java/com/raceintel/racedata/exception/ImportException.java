package com.raceintel.racedata.exception;

/**
 * A source file could not be loaded. The file's transaction has been rolled back.
 */
public class ImportException extends RaceDataException {

    public ImportException(String message) {
        super(ErrorCode.IMPORT_ERROR, message);
    }

    public ImportException(String message, Throwable cause) {
        super(ErrorCode.IMPORT_ERROR, message, cause);
    }
}
