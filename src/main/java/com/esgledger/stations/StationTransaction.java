package com.esgledger.stations;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one gross revenue transaction and its fee split.
 */
@Entity
@Table(name = "station_transactions", indexes = {
    @Index(name = "idx_station_tx_station_id", columnList = "station_id"),
    @Index(name = "idx_station_tx_recorded_at", columnList = "recorded_at")
})
@Data
@NoArgsConstructor
public class StationTransaction {

    @Id
    private String transactionId;

    @Column(name = "station_id")
    private String stationId;

    private long grossAmount;

    private long fee;

    private long net;

    private int feeRateBps;

    /**
     * Caller-supplied reference, such as the charging session or payment hash.
     */
    private String externalRef;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    public StationTransaction(String stationId, long grossAmount, long fee, long net,
                              int feeRateBps, String externalRef, Instant recordedAt) {
        this.transactionId = UUID.randomUUID().toString();
        this.stationId = stationId;
        this.grossAmount = grossAmount;
        this.fee = fee;
        this.net = net;
        this.feeRateBps = feeRateBps;
        this.externalRef = externalRef;
        this.recordedAt = recordedAt;
    }
}
