package com.esgledger.stations;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Platform-wide settlement state: the fee rate and global totals.
 * Stored as a single row.
 */
@Entity
@Table(name = "settlement_platform")
@Data
@NoArgsConstructor
public class SettlementPlatform {

    public static final String SINGLETON_ID = "stations";

    @Id
    private String id;

    /**
     * Platform fee in basis points (500 = 5%).
     */
    private int feeRateBps;

    private long totalVolume;

    private long totalFeesCollected;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public SettlementPlatform(int feeRateBps) {
        this.id = SINGLETON_ID;
        this.feeRateBps = feeRateBps;
        this.totalVolume = 0L;
        this.totalFeesCollected = 0L;
        this.updatedAt = Instant.now();
    }

    public void recordRevenue(long gross, long fee) {
        this.totalVolume += gross;
        this.totalFeesCollected += fee;
        this.updatedAt = Instant.now();
    }

    public void changeFeeRate(int feeRateBps) {
        this.feeRateBps = feeRateBps;
        this.updatedAt = Instant.now();
    }
}
