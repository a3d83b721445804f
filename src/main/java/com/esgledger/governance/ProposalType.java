package com.esgledger.governance;

/**
 * Kinds of committee proposals and the effect each has when executed.
 */
public enum ProposalType {
    /**
     * Authorize a ledger mint. Payload: {"recipient": "...", "amount": n}.
     * Execution returns the grant token to present to the ledger.
     */
    MINT,

    /**
     * Halt mint, burn and transfer.
     */
    PAUSE,

    UNPAUSE,

    /**
     * Freeze an account. Payload: {"account": "..."}.
     */
    FREEZE,

    UNFREEZE,

    /**
     * Free-form decision. Execution only records that it passed.
     */
    TEXT
}
