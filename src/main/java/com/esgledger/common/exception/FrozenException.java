package com.esgledger.common.exception;

/**
 * Thrown when a frozen account attempts to send funds.
 */
public class FrozenException extends EsgLedgerException {

    public FrozenException(String accountId) {
        super(ErrorKind.FROZEN, "Account is frozen: " + accountId);
    }
}
