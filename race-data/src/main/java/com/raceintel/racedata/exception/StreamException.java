package com.raceintel.racedata.exception;

/**
 * The replay read layer failed mid-stream. Terminates one replay session only.
 */
public class StreamException extends RaceDataException {

    public StreamException(String message, Throwable cause) {
        super(ErrorCode.STREAM_ERROR, message, cause);
    }
}
