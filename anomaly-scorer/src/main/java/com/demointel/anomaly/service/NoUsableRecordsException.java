package com.demointel.anomaly.service;

/**
 * Raised when cleaning leaves nothing to score.
 */
public class NoUsableRecordsException extends RuntimeException {

    public NoUsableRecordsException(int rawRows) {
        super("No usable records after cleaning " + rawRows + " raw rows");
    }
}
