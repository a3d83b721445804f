package com.esgledger.stations;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A revenue-collecting charging station and its running totals.
 */
@Entity
@Table(name = "stations", indexes = {
    @Index(name = "idx_station_operator_id", columnList = "operator_id")
})
@Data
@NoArgsConstructor
public class Station {

    @Id
    private String stationId;

    /**
     * Ledger account of the operator receiving settlements.
     */
    @Column(name = "operator_id")
    private String operatorId;

    @Enumerated(EnumType.STRING)
    private StationStatus status;

    /**
     * Gross revenue recorded.
     */
    private long volume;

    private long feesPaid;

    /**
     * Net revenue owed to the operator and not yet settled.
     */
    private long pending;

    /**
     * Net revenue paid out so far.
     */
    private long settled;

    @Column(name = "registered_at")
    private Instant registeredAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Station(String stationId, String operatorId, Instant registeredAt) {
        this.stationId = stationId;
        this.operatorId = operatorId;
        this.status = StationStatus.ACTIVE;
        this.volume = 0L;
        this.feesPaid = 0L;
        this.pending = 0L;
        this.settled = 0L;
        this.registeredAt = registeredAt;
        this.updatedAt = registeredAt;
    }

    public boolean isActive() {
        return status == StationStatus.ACTIVE;
    }

    public void recordRevenue(long gross, long fee, long net) {
        this.volume += gross;
        this.feesPaid += fee;
        this.pending += net;
        this.updatedAt = Instant.now();
    }

    public void paySettlement(long amount) {
        this.pending -= amount;
        this.settled += amount;
        this.updatedAt = Instant.now();
    }

    public void deactivate() {
        this.status = StationStatus.INACTIVE;
        this.updatedAt = Instant.now();
    }
}
