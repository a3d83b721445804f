package com.esgledger.stations;

import com.esgledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Accounting record of a station's owed amount moving from pending to paid.
 */
@Entity
@Table(name = "settlements", indexes = {
    @Index(name = "idx_settlement_station_id", columnList = "station_id")
})
@Data
@NoArgsConstructor
public class Settlement {

    @Id
    private String settlementId;

    @Column(name = "station_id")
    private String stationId;

    /**
     * The station's pending amount at request time.
     */
    private long amount;

    /**
     * Platform fee already withheld on {@link #amount}.
     */
    private long feeAmount;

    /**
     * Optional settlement period label, e.g. "2026-09".
     */
    private String period;

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private SettlementStatus status;

    @Column(name = "requested_at")
    private Instant requestedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    private String approvedBy;

    @Column(name = "completed_at")
    private Instant completedAt;

    public Settlement(String settlementId, String stationId, long amount, long feeAmount,
                      String period, Instant requestedAt) {
        this.settlementId = settlementId;
        this.stationId = stationId;
        this.amount = amount;
        this.feeAmount = feeAmount;
        this.period = period;
        this.status = SettlementStatus.PENDING;
        this.requestedAt = requestedAt;
    }

    public void approve(String approvedBy, Instant now) {
        if (status != SettlementStatus.PENDING) {
            throw new InvalidStateException("Settlement", settlementId, status.name(), "approve");
        }
        this.status = SettlementStatus.APPROVED;
        this.approvedBy = approvedBy;
        this.approvedAt = now;
    }

    public void complete(Instant now) {
        if (status != SettlementStatus.APPROVED) {
            throw new InvalidStateException("Settlement", settlementId, status.name(), "withdraw");
        }
        this.status = SettlementStatus.COMPLETED;
        this.completedAt = now;
    }
}
