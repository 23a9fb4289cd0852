package com.raceintel.racedata.exception;

/**
 * Error kinds surfaced by the import pipeline and the replay streamer.
 */
public enum ErrorCode {
    PARSE_ERROR,
    IDENTITY_ERROR,
    IMPORT_ERROR,
    STREAM_ERROR,
    CONFIG_ERROR
}
