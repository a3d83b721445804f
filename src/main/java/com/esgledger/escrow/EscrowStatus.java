package com.esgledger.escrow;

/**
 * Lifecycle states for an enterprise escrow.
 *
 * CREATED to FUNDED to SHIPPED to COMPLETED is the happy path. DISPUTED and
 * CANCELLED are reachable from any non-terminal state.
 */
public enum EscrowStatus {
    CREATED,
    FUNDED,
    SHIPPED,
    COMPLETED,
    DISPUTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
