package com.esgledger.ledger;

/**
 * Types of ledger journal entries.
 */
public enum TransactionType {
    /**
     * New tokens credited to an account. Increases total supply.
     */
    MINT,

    /**
     * Tokens destroyed from an account. Decreases total supply.
     */
    BURN,

    /**
     * Tokens moved between two accounts. Total supply is unchanged.
     */
    TRANSFER
}
