package com.esgledger.rewards;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A verified carbon-reduction activity and the reward it accrued.
 */
@Entity
@Table(name = "carbon_activities", indexes = {
    @Index(name = "idx_activity_account_id", columnList = "account_id")
})
@Data
@NoArgsConstructor
public class CarbonActivity {

    @Id
    private String activityId;

    @Column(name = "account_id")
    private String accountId;

    private long carbonKg;

    /**
     * Reward rate in effect when the activity was registered.
     */
    private long rewardRate;

    private long rewardAmount;

    /**
     * Caller-supplied reference, such as the hash of the measurement evidence.
     */
    private String activityRef;

    @Column(name = "recorded_at")
    private Instant recordedAt;

    public CarbonActivity(String accountId, long carbonKg, long rewardRate, long rewardAmount,
                          String activityRef, Instant recordedAt) {
        this.activityId = UUID.randomUUID().toString();
        this.accountId = accountId;
        this.carbonKg = carbonKg;
        this.rewardRate = rewardRate;
        this.rewardAmount = rewardAmount;
        this.activityRef = activityRef;
        this.recordedAt = recordedAt;
    }
}
