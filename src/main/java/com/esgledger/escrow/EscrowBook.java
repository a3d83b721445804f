package com.esgledger.escrow;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Module-wide escrow totals and settings. Stored as a single row.
 */
@Entity
@Table(name = "escrow_book")
@Data
@NoArgsConstructor
public class EscrowBook {

    public static final String SINGLETON_ID = "escrow";

    @Id
    private String id;

    /**
     * Deposits currently held.
     */
    private long totalEscrowed;

    /**
     * Amounts paid out to sellers.
     */
    private long totalCompleted;

    /**
     * Published dispute arbitration fee. Recorded, not charged.
     */
    private long arbitrationFee;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public EscrowBook(long arbitrationFee) {
        this.id = SINGLETON_ID;
        this.totalEscrowed = 0L;
        this.totalCompleted = 0L;
        this.arbitrationFee = arbitrationFee;
        this.updatedAt = Instant.now();
    }

    public void recordDeposit(long amount) {
        this.totalEscrowed += amount;
        this.updatedAt = Instant.now();
    }

    /**
     * Record funds leaving the escrow holding account.
     *
     * @param toSeller the part paid to the seller
     * @param toBuyer  the part refunded to the buyer
     */
    public void recordPayout(long toSeller, long toBuyer) {
        this.totalEscrowed -= toSeller + toBuyer;
        this.totalCompleted += toSeller;
        this.updatedAt = Instant.now();
    }

    public void changeArbitrationFee(long arbitrationFee) {
        this.arbitrationFee = arbitrationFee;
        this.updatedAt = Instant.now();
    }
}
