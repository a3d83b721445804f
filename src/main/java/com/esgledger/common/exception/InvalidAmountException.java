package com.esgledger.common.exception;

/**
 * Thrown for zero, negative or out-of-range input values.
 */
public class InvalidAmountException extends EsgLedgerException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(ErrorKind.INVALID_AMOUNT, message, cause);
    }
}
