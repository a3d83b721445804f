package com.esgledger.common.exception;

/**
 * Thrown when the caller lacks the identity or role an operation requires.
 */
public class UnauthorizedException extends EsgLedgerException {

    public UnauthorizedException(String caller, String operation) {
        super(ErrorKind.UNAUTHORIZED,
            String.format("Caller %s is not authorized to perform '%s'", caller, operation));
    }

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
