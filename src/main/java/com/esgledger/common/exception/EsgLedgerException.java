package com.esgledger.common.exception;

/**
 * Base exception for all ESG ledger exceptions.
 */
public class EsgLedgerException extends RuntimeException {

    private final ErrorKind kind;

    public EsgLedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EsgLedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
