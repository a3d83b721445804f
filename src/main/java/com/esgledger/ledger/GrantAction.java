package com.esgledger.ledger;

/**
 * Privileged ledger actions a grant can authorize.
 * Only governance may issue anything other than {@link #MINT}.
 */
public enum GrantAction {
    MINT,
    PAUSE,
    UNPAUSE,
    FREEZE,
    UNFREEZE
}
