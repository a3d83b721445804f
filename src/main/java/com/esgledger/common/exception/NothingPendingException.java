package com.esgledger.common.exception;

/**
 * Thrown when requesting a settlement for a station with nothing owed.
 */
public class NothingPendingException extends EsgLedgerException {

    public NothingPendingException(String stationId) {
        super(ErrorKind.NOTHING_PENDING, "Nothing pending for station: " + stationId);
    }
}
