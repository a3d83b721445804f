package com.esgledger.governance;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Persisted committee proposal.
 *
 * Starts with one vote (the creator's) and can be executed once its vote
 * count reaches the required approvals, as long as it has not expired.
 * Expiry is only evaluated when the proposal is next touched.
 */
@Entity
@Table(name = "proposals", indexes = {
    @Index(name = "idx_proposal_creator", columnList = "creator_id")
})
@Data
@NoArgsConstructor
public class Proposal {

    @Id
    private String proposalId;

    @Column(name = "creator_id")
    private String creatorId;

    @Enumerated(EnumType.STRING)
    private ProposalType proposalType;

    @Column(length = 2000)
    private String payload;

    /**
     * Approvals so far, including the creator's implicit vote.
     * Repeat votes by the same member are counted again.
     */
    private int voteCount;

    @Setter(AccessLevel.NONE)
    private boolean executed;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    private String executedBy;

    /**
     * Grant issued on execution, if the proposal type issues one.
     */
    @Setter(AccessLevel.NONE)
    private String grantId;

    public Proposal(String proposalId, String creatorId, ProposalType proposalType,
                    String payload, Instant createdAt, Instant expiresAt) {
        this.proposalId = proposalId;
        this.creatorId = creatorId;
        this.proposalType = proposalType;
        this.payload = payload;
        this.voteCount = 1;
        this.executed = false;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /**
     * A proposal is live strictly before its expiry.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public void recordApproval() {
        this.voteCount++;
    }

    public void markExecuted(String executedBy, Instant now) {
        this.executed = true;
        this.executedBy = executedBy;
        this.executedAt = now;
    }

    /**
     * Record the grant issued from this proposal. Only an executed proposal backs a grant.
     */
    public void attachGrant(String grantId) {
        if (!executed) {
            throw new IllegalStateException("Proposal " + proposalId + " is not executed");
        }
        this.grantId = grantId;
    }
}
