package com.esgledger.common.exception;

/**
 * Thrown when re-opting-in an account that still carries a balance.
 */
public class AlreadyActiveException extends EsgLedgerException {

    public AlreadyActiveException(String accountId, long balance) {
        super(ErrorKind.ALREADY_ACTIVE,
            String.format("Account %s is already active with balance %d", accountId, balance));
    }
}
