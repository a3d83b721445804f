package com.esgledger.governance;

import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.GrantSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Backs governance grants with executed committee proposals.
 *
 * The grant must carry exactly what the proposal voted on: the action its
 * type maps to, and the recipient and amount (or account) of its payload.
 */
@Component
@RequiredArgsConstructor
public class ProposalGrantSource implements GrantSource {

    private final ProposalRepository proposalRepository;
    private final ProposalPayloads payloads;

    @Override
    public GrantIssuer getIssuer() {
        return GrantIssuer.GOVERNANCE;
    }

    @Override
    public void verify(GrantAction action, String targetAccountId, long amount, String proposalId) {
        Proposal proposal = proposalRepository.findById(proposalId)
            .filter(Proposal::isExecuted)
            .orElseThrow(() -> new UnauthorizedException("No executed proposal backs grant source " + proposalId));

        if (!authorizes(proposal, action, targetAccountId, amount)) {
            throw new UnauthorizedException(String.format(
                "Proposal %s (%s) does not authorize %s of %d for %s",
                proposalId, proposal.getProposalType(), action, amount, targetAccountId));
        }
    }

    private boolean authorizes(Proposal proposal, GrantAction action, String targetAccountId, long amount) {
        return switch (proposal.getProposalType()) {
            case MINT -> {
                ProposalPayloads.MintPayload mint = payloads.mint(proposal.getPayload());
                yield action == GrantAction.MINT
                    && mint.getRecipient().equals(targetAccountId)
                    && mint.getAmount() == amount;
            }
            case PAUSE -> action == GrantAction.PAUSE && targetAccountId == null;
            case UNPAUSE -> action == GrantAction.UNPAUSE && targetAccountId == null;
            case FREEZE -> action == GrantAction.FREEZE
                && Objects.equals(payloads.account(proposal.getPayload()).getAccount(), targetAccountId);
            case UNFREEZE -> action == GrantAction.UNFREEZE
                && Objects.equals(payloads.account(proposal.getPayload()).getAccount(), targetAccountId);
            case TEXT -> false;
        };
    }
}
