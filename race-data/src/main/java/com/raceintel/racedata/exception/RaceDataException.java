package com.raceintel.racedata.exception;

import lombok.Getter;

/**
 * Base exception for race data failures. Always carries an {@link ErrorCode}
 * so the CLI and the stream layer can report the failure kind verbatim.
 */
@Getter
public class RaceDataException extends RuntimeException {

    private final ErrorCode code;

    public RaceDataException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RaceDataException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
