package com.esgledger.common.exception;

/**
 * Thrown when attempting an operation on a record in a state that forbids it.
 */
public class InvalidStateException extends EsgLedgerException {

    public InvalidStateException(String recordType, String recordId, String currentState, String operation) {
        super(ErrorKind.INVALID_STATE, String.format("Cannot perform operation '%s' on %s %s in state %s",
            operation, recordType, recordId, currentState));
    }

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
