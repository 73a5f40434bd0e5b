package com.skyreader.sync.ingest;

/**
 * A commit's record lacks fields required to cache it.
 */
public class InvalidRecordException extends RuntimeException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
