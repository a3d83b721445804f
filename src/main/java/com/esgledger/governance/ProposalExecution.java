package com.esgledger.governance;

import com.esgledger.ledger.AuthorizationToken;
import lombok.Value;

/**
 * Outcome of executing a proposal.
 *
 * For MINT proposals {@code grant} carries the token to present to
 * {@link com.esgledger.ledger.LedgerService#mint}; it is null otherwise.
 */
@Value
public class ProposalExecution {
    String proposalId;
    ProposalType proposalType;
    AuthorizationToken grant;
}
