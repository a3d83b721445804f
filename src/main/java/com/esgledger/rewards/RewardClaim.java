package com.esgledger.rewards;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One settled reward claim. Backs the mint that pays it out.
 */
@Entity
@Table(name = "reward_claims", indexes = {
    @Index(name = "idx_claim_account_id", columnList = "account_id")
})
@Getter
@NoArgsConstructor
public class RewardClaim {

    @Id
    private String claimId;

    @Column(name = "account_id")
    private String accountId;

    private long amount;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    public RewardClaim(String accountId, long amount) {
        this.claimId = UUID.randomUUID().toString();
        this.accountId = accountId;
        this.amount = amount;
        this.claimedAt = Instant.now();
    }
}
