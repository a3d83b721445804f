package com.esgledger.ledger;

/**
 * Record that backs the grants of one issuer.
 *
 * The ledger asks the source of a grant's issuer to vouch for every grant
 * before it is stored:
 * - GOVERNANCE grants need an executed proposal
 * - REWARD_ACCRUAL grants need a recorded reward claim
 * - STATION_SETTLEMENT grants need a completed settlement
 *
 * A source record backs at most one grant. Issuers without a registered
 * source cannot obtain grants at all.
 */
public interface GrantSource {

    /**
     * The issuer this source vouches for.
     */
    GrantIssuer getIssuer();

    /**
     * Check that {@code sourceRef} names a record authorizing exactly this grant.
     *
     * @throws com.esgledger.common.exception.UnauthorizedException if it does not
     */
    void verify(GrantAction action, String targetAccountId, long amount, String sourceRef);
}
