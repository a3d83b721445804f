package com.esgledger.rewards;

import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.GrantSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Backs reward mints with the claim record they pay out.
 */
@Component
@RequiredArgsConstructor
public class RewardClaimGrantSource implements GrantSource {

    private final RewardClaimRepository claimRepository;

    @Override
    public GrantIssuer getIssuer() {
        return GrantIssuer.REWARD_ACCRUAL;
    }

    @Override
    public void verify(GrantAction action, String targetAccountId, long amount, String claimId) {
        RewardClaim claim = claimRepository.findById(claimId)
            .orElseThrow(() -> new UnauthorizedException("No reward claim backs grant source " + claimId));
        if (!claim.getAccountId().equals(targetAccountId) || claim.getAmount() != amount) {
            throw new UnauthorizedException(String.format(
                "Reward claim %s pays %d to %s, not %d to %s",
                claimId, claim.getAmount(), claim.getAccountId(), amount, targetAccountId));
        }
    }
}
