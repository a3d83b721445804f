package com.esgledger.rewards;

import com.esgledger.common.Amounts;
import com.esgledger.common.exception.PausedException;
import com.esgledger.ledger.AuthorizationToken;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Service converting verified carbon reductions into token rewards.
 *
 * Registered activity accrues pending rewards without touching the ledger;
 * a claim mints the whole pending amount in one step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardService {

    private final RewardProfileRepository profileRepository;
    private final CarbonActivityRepository activityRepository;
    private final RewardPoolRepository poolRepository;
    private final RewardClaimRepository claimRepository;
    private final LedgerService ledgerService;

    @Value("${esg-ledger.rewards.reward-rate:1000}")
    private long defaultRewardRate;

    /**
     * Accrue {@code carbonKg * rewardRate} pending rewards to an account.
     *
     * @throws com.esgledger.common.exception.InvalidAmountException if carbonKg is not positive
     */
    @Transactional
    public RewardProfile registerActivity(String accountId, long carbonKg, String activityRef, Instant now) {
        Amounts.requirePositive(carbonKg, "Carbon reduction (kg)");

        RewardPool pool = loadPoolForUpdate();
        long reward = Amounts.multiply(carbonKg, pool.getRewardRate(), "Reward");

        RewardProfile profile = profileRepository.findById(accountId)
            .orElseGet(() -> new RewardProfile(accountId));
        Amounts.add(profile.getPendingRewards(), reward, "Pending rewards");
        Amounts.add(profile.getTotalCarbonReductionKg(), carbonKg, "Total carbon reduction");

        profile.accrue(carbonKg, reward);
        profileRepository.save(profile);
        activityRepository.save(new CarbonActivity(accountId, carbonKg, pool.getRewardRate(), reward, activityRef, now));

        log.info("Registered {} kg CO2 for {}: reward={}, pending={}",
            carbonKg, accountId, reward, profile.getPendingRewards());

        return profile;
    }

    /**
     * Mint all pending rewards into the account's ledger balance.
     *
     * @return the amount claimed; 0 with no effect when nothing is pending
     */
    @Transactional
    public long claim(String accountId) {
        RewardProfile profile = profileRepository.findById(accountId).orElse(null);
        if (profile == null || profile.getPendingRewards() == 0) {
            log.debug("Nothing to claim for {}", accountId);
            return 0L;
        }

        long amount = profile.getPendingRewards();
        if (ledgerService.isPaused()) {
            throw new PausedException("claim");
        }
        ledgerService.requireMintable(accountId, amount);
        RewardPool pool = loadPoolForUpdate();
        Amounts.add(pool.getTotalDistributed(), amount, "Total distributed");
        Amounts.add(profile.getClaimedRewards(), amount, "Claimed rewards");

        profile.settleClaim();
        pool.recordDistribution(amount);
        profileRepository.save(profile);
        poolRepository.save(pool);
        RewardClaim claim = claimRepository.save(new RewardClaim(accountId, amount));

        AuthorizationToken grant = ledgerService.issueGrant(
            GrantIssuer.REWARD_ACCRUAL, GrantAction.MINT, accountId, amount, claim.getClaimId());
        ledgerService.mint(accountId, amount, grant);

        log.info("Claimed {} rewards for {} (total distributed={})",
            amount, accountId, pool.getTotalDistributed());

        return amount;
    }

    @Transactional
    public void setRewardRate(String callerId, long rewardRate) {
        ledgerService.requireAdmin(callerId, "set reward rate");
        Amounts.requirePositive(rewardRate, "Reward rate");
        RewardPool pool = loadPoolForUpdate();
        pool.changeRewardRate(rewardRate);
        poolRepository.save(pool);
        log.info("Reward rate set to {}", rewardRate);
    }

    /**
     * Profile for an account; an account with no activity has an empty profile.
     */
    @Transactional(readOnly = true)
    public RewardProfile getProfile(String accountId) {
        return profileRepository.findById(accountId)
            .orElseGet(() -> new RewardProfile(accountId));
    }

    @Transactional(readOnly = true)
    public List<CarbonActivity> getActivities(String accountId) {
        return activityRepository.findByAccountIdOrderByRecordedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<RewardClaim> getClaims(String accountId) {
        return claimRepository.findByAccountIdOrderByClaimedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public RewardPool getPool() {
        return poolRepository.findById(RewardPool.SINGLETON_ID)
            .orElseGet(() -> new RewardPool(defaultRewardRate));
    }

    private RewardPool loadPoolForUpdate() {
        return poolRepository.findById(RewardPool.SINGLETON_ID)
            .orElseGet(() -> poolRepository.save(new RewardPool(defaultRewardRate)));
    }
}
