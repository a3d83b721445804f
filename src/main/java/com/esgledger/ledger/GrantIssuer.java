package com.esgledger.ledger;

/**
 * Components allowed to issue ledger grants.
 */
public enum GrantIssuer {
    /**
     * An executed committee proposal.
     */
    GOVERNANCE,

    /**
     * A reward claim minting the claimant's pending rewards.
     */
    REWARD_ACCRUAL,

    /**
     * A station settlement paying out an operator's net revenue.
     */
    STATION_SETTLEMENT
}
