package com.esgledger.common.exception;

/**
 * Thrown when an account has insufficient balance for a burn or transfer.
 */
public class InsufficientBalanceException extends EsgLedgerException {

    public InsufficientBalanceException(String accountId, long required, long available) {
        super(ErrorKind.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance in account %s. Required: %d, Available: %d",
                accountId, required, available));
    }
}
