package com.esgledger.rewards;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Module-wide reward state. Stored as a single row.
 */
@Entity
@Table(name = "reward_pool")
@Data
@NoArgsConstructor
public class RewardPool {

    public static final String SINGLETON_ID = "rewards";

    @Id
    private String id;

    /**
     * Tokens (smallest unit) per kg of CO2 reduced.
     */
    private long rewardRate;

    private long totalDistributed;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public RewardPool(long rewardRate) {
        this.id = SINGLETON_ID;
        this.rewardRate = rewardRate;
        this.totalDistributed = 0L;
        this.updatedAt = Instant.now();
    }

    public void recordDistribution(long amount) {
        this.totalDistributed += amount;
        this.updatedAt = Instant.now();
    }

    public void changeRewardRate(long rewardRate) {
        this.rewardRate = rewardRate;
        this.updatedAt = Instant.now();
    }
}
