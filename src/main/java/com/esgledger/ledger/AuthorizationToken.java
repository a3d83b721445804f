package com.esgledger.ledger;

import lombok.Value;

/**
 * Capability presented to the ledger for a privileged action.
 *
 * Tokens are handed out by {@link LedgerService#issueGrant} and name a
 * persisted {@link LedgerGrant}. Building one by hand does not help: the
 * ledger checks it against the stored grant and consumes the grant on use.
 */
@Value
public class AuthorizationToken {
    String grantId;
    GrantIssuer issuer;
    GrantAction action;
    String targetAccountId;
    long amount;
}
