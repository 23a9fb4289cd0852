package com.raceintel.racedata.exception;

/**
 * A record references a vehicle that cannot be resolved to a canonical id.
 * Fatal to that record only.
 */
public class IdentityException extends RaceDataException {

    public IdentityException(String message) {
        super(ErrorCode.IDENTITY_ERROR, message);
    }
}
