package com.raceintel.racedata.parser;

import com.raceintel.racedata.exception.ErrorCode;
import com.raceintel.racedata.exception.RaceDataException;

/**
 * A single CSV row could not be turned into a record. Caught by the parser,
 * which drops the row and keeps going.
 */
class CsvRowException extends RaceDataException {

    CsvRowException(String message) {
        super(ErrorCode.PARSE_ERROR, message);
    }
}
