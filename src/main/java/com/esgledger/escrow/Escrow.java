package com.esgledger.escrow;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Buyer funds held against a seller's delivery obligation.
 *
 * The deposit is either zero or equal to the amount, and moves
 * buyer to escrow to (seller or buyer) exactly once.
 */
@Entity
@Table(name = "escrows", indexes = {
    @Index(name = "idx_escrow_buyer_id", columnList = "buyer_id"),
    @Index(name = "idx_escrow_seller_id", columnList = "seller_id")
})
@Data
@NoArgsConstructor
public class Escrow {

    @Id
    private String escrowId;

    @Column(name = "buyer_id")
    private String buyerId;

    @Column(name = "seller_id")
    private String sellerId;

    private long amount;

    private long depositAmount;

    @Enumerated(EnumType.STRING)
    private EscrowStatus status;

    private boolean buyerConfirmed;

    private boolean sellerConfirmed;

    /**
     * After this instant anyone may release the funds to the seller.
     */
    private Instant deadline;

    /**
     * Hash of the purchase contract terms.
     */
    private String contractHash;

    private String shipmentRef;

    private String receiptRef;

    @Column(length = 1000)
    private String disputeReason;

    private String disputedBy;

    @Enumerated(EnumType.STRING)
    private DisputeResolution resolution;

    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "funded_at")
    private Instant fundedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public Escrow(String escrowId, String buyerId, String sellerId, long amount,
                  Instant deadline, String contractHash, String createdBy, Instant createdAt) {
        this.escrowId = escrowId;
        this.buyerId = buyerId;
        this.sellerId = sellerId;
        this.amount = amount;
        this.depositAmount = 0L;
        this.status = EscrowStatus.CREATED;
        this.buyerConfirmed = false;
        this.sellerConfirmed = false;
        this.deadline = deadline;
        this.contractHash = contractHash;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public boolean isParty(String callerId) {
        return buyerId.equals(callerId) || sellerId.equals(callerId);
    }

    public boolean isConfirmedByBoth() {
        return buyerConfirmed && sellerConfirmed;
    }

    public boolean isPastDeadline(Instant now) {
        return now.isAfter(deadline);
    }

    public void markFunded(Instant now) {
        this.depositAmount = amount;
        this.status = EscrowStatus.FUNDED;
        this.fundedAt = now;
    }

    public void markShipped(String shipmentRef) {
        this.sellerConfirmed = true;
        this.shipmentRef = shipmentRef;
        this.status = EscrowStatus.SHIPPED;
    }

    public void markReceived(String receiptRef) {
        this.buyerConfirmed = true;
        this.receiptRef = receiptRef;
    }

    public void markDisputed(String disputedBy, String reason) {
        this.status = EscrowStatus.DISPUTED;
        this.disputedBy = disputedBy;
        this.disputeReason = reason;
    }

    public void markCompleted(Instant now) {
        this.status = EscrowStatus.COMPLETED;
        this.completedAt = now;
    }

    public void markResolved(DisputeResolution resolution, Instant now) {
        this.resolution = resolution;
        markCompleted(now);
    }

    public void markCancelled(Instant now) {
        this.status = EscrowStatus.CANCELLED;
        this.completedAt = now;
    }
}
