package com.esgledger.common;

import com.esgledger.common.exception.InvalidAmountException;

/**
 * Integer arithmetic for token amounts.
 *
 * All amounts are unsigned values in the smallest token unit. Nothing on the
 * ledger path uses floating point, and every division truncates toward zero.
 */
public final class Amounts {

    public static final int BPS_DENOMINATOR = 10_000;

    private Amounts() {
    }

    public static long requirePositive(long amount, String field) {
        if (amount <= 0) {
            throw new InvalidAmountException(field + " must be positive, was " + amount);
        }
        return amount;
    }

    public static long requireNonNegative(long amount, String field) {
        if (amount < 0) {
            throw new InvalidAmountException(field + " cannot be negative, was " + amount);
        }
        return amount;
    }

    /**
     * Validates a basis point rate. A rate of 10000 or more would leave no net amount.
     */
    public static int requireFeeRate(int bps) {
        if (bps < 0 || bps >= BPS_DENOMINATOR) {
            throw new InvalidAmountException("Fee rate must be within [0, 10000) bps, was " + bps);
        }
        return bps;
    }

    /**
     * floor(gross * bps / 10000). Never rounds up.
     */
    public static long feeFor(long gross, int bps) {
        return multiply(gross, bps, "fee") / BPS_DENOMINATOR;
    }

    /**
     * Fee already withheld on a net amount: floor(net * bps / (10000 - bps)).
     */
    public static long withheldFeeOn(long net, int bps) {
        return multiply(net, bps, "withheld fee") / (BPS_DENOMINATOR - bps);
    }

    public static long multiply(long a, long b, String field) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(field + " overflows: " + a + " * " + b, e);
        }
    }

    public static long add(long a, long b, String field) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(field + " overflows: " + a + " + " + b, e);
        }
    }
}
