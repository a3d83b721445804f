package com.esgledger.stations;

/**
 * Status of a station settlement. Transitions only move forward:
 * PENDING to APPROVED to COMPLETED.
 */
public enum SettlementStatus {
    /**
     * Requested by the operator, awaiting admin approval.
     */
    PENDING,

    /**
     * Approved by the admin, awaiting withdrawal.
     */
    APPROVED,

    /**
     * Paid out to the operator. Terminal.
     */
    COMPLETED
}
