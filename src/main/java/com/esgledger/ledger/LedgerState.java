package com.esgledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger-wide state: the admin identity, total supply and the pause switch.
 * Stored as a single row.
 */
@Entity
@Table(name = "ledger_state")
@Data
@NoArgsConstructor
public class LedgerState {

    public static final String SINGLETON_ID = "ledger";

    @Id
    private String id;

    private String adminId;

    private long totalSupply;

    /**
     * Halts mint, burn and transfer while set.
     */
    private boolean paused;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public LedgerState(String adminId) {
        this.id = SINGLETON_ID;
        this.adminId = adminId;
        this.totalSupply = 0L;
        this.paused = false;
        this.updatedAt = Instant.now();
    }

    void increaseSupply(long amount) {
        this.totalSupply = Math.addExact(this.totalSupply, amount);
        this.updatedAt = Instant.now();
    }

    void decreaseSupply(long amount) {
        this.totalSupply -= amount;
        this.updatedAt = Instant.now();
    }

    void pause(boolean paused) {
        this.paused = paused;
        this.updatedAt = Instant.now();
    }
}
