package com.esgledger.rewards;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-account reward bookkeeping.
 *
 * Pending rewards only grow through registered activity and only drop, to
 * zero, through a claim that moves the whole amount to claimed rewards.
 */
@Entity
@Table(name = "reward_profiles")
@Data
@NoArgsConstructor
public class RewardProfile {

    @Id
    private String accountId;

    private long pendingRewards;

    private long claimedRewards;

    private long totalCarbonReductionKg;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public RewardProfile(String accountId) {
        this.accountId = accountId;
        this.pendingRewards = 0L;
        this.claimedRewards = 0L;
        this.totalCarbonReductionKg = 0L;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void accrue(long carbonKg, long reward) {
        this.pendingRewards += reward;
        this.totalCarbonReductionKg += carbonKg;
        this.updatedAt = Instant.now();
    }

    /**
     * Move all pending rewards to claimed.
     *
     * @return the amount moved
     */
    public long settleClaim() {
        long amount = pendingRewards;
        this.claimedRewards += amount;
        this.pendingRewards = 0L;
        this.updatedAt = Instant.now();
        return amount;
    }
}
