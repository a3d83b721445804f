package com.esgledger.common.exception;

/**
 * Thrown when voting on or executing a proposal that was already executed.
 */
public class AlreadyExecutedException extends EsgLedgerException {

    public AlreadyExecutedException(String proposalId) {
        super(ErrorKind.ALREADY_EXECUTED, "Proposal already executed: " + proposalId);
    }
}
