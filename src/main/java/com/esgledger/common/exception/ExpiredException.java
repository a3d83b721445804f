package com.esgledger.common.exception;

import java.time.Instant;

/**
 * Thrown when a record is touched at or after its stored expiry.
 */
public class ExpiredException extends EsgLedgerException {

    public ExpiredException(String recordType, String recordId, Instant expiry) {
        super(ErrorKind.EXPIRED, String.format("%s %s expired at %s", recordType, recordId, expiry));
    }
}
