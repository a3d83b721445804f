package com.esgledger.common.exception;

/**
 * Thrown when a balance-moving operation is attempted while the ledger is paused.
 */
public class PausedException extends EsgLedgerException {

    public PausedException(String operation) {
        super(ErrorKind.PAUSED, "Ledger is paused, rejected operation: " + operation);
    }
}
