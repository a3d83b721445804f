package com.esgledger.common.exception;

/**
 * Thrown when executing a proposal that has not collected enough approvals.
 */
public class QuorumNotMetException extends EsgLedgerException {

    public QuorumNotMetException(String proposalId, int votes, int required) {
        super(ErrorKind.QUORUM_NOT_MET,
            String.format("Proposal %s has %d of %d required approvals", proposalId, votes, required));
    }
}
