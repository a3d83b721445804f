package com.esgledger.common.exception;

/**
 * Thrown when an account, proposal, station, settlement or escrow is not found.
 */
public class RecordNotFoundException extends EsgLedgerException {

    public RecordNotFoundException(String recordType, String recordId) {
        super(ErrorKind.NOT_FOUND, recordType + " not found: " + recordId);
    }
}
