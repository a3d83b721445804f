package com.esgledger.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Committee-wide settings. Stored as a single row.
 */
@Entity
@Table(name = "governance_settings")
@Data
@NoArgsConstructor
public class GovernanceSettings {

    public static final String SINGLETON_ID = "governance";

    @Id
    private String id;

    private int requiredApprovals;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public GovernanceSettings(int requiredApprovals) {
        this.id = SINGLETON_ID;
        this.requiredApprovals = requiredApprovals;
        this.updatedAt = Instant.now();
    }

    public void changeRequiredApprovals(int requiredApprovals) {
        this.requiredApprovals = requiredApprovals;
        this.updatedAt = Instant.now();
    }
}
