package com.esgledger.common.exception;

/**
 * Failure kinds reported by the core operations.
 *
 * Every rejected operation reports exactly one kind, and no rejected
 * operation leaves a partial effect behind.
 */
public enum ErrorKind {
    /**
     * Caller lacks the required role or identity.
     */
    UNAUTHORIZED,

    /**
     * Operation attempted from a state that forbids it.
     */
    INVALID_STATE,

    /**
     * Proposal has already been executed.
     */
    ALREADY_EXECUTED,

    /**
     * Account is already opted in with a live balance.
     */
    ALREADY_ACTIVE,

    INSUFFICIENT_BALANCE,

    NOTHING_PENDING,

    /**
     * Zero, negative or out-of-range input.
     */
    INVALID_AMOUNT,

    PAUSED,

    FROZEN,

    STATION_INACTIVE,

    /**
     * Record is past its stored deadline.
     */
    EXPIRED,

    QUORUM_NOT_MET,

    /**
     * Referenced account, proposal, station, settlement or escrow does not exist.
     */
    NOT_FOUND
}
