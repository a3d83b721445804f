package com.esgledger.escrow;

/**
 * How an admin settles a disputed escrow's deposit.
 */
public enum DisputeResolution {
    /**
     * Return the whole deposit to the buyer.
     */
    REFUND_BUYER,

    /**
     * Pay the whole deposit to the seller.
     */
    PAY_SELLER,

    /**
     * Seller receives floor(deposit / 2), the buyer the remainder.
     */
    SPLIT
}
