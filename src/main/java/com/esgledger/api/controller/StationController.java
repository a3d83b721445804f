package com.esgledger.api.controller;

import com.esgledger.api.dto.RegisterStationRequest;
import com.esgledger.api.dto.SettlementRequest;
import com.esgledger.api.dto.StationTransactionRequest;
import com.esgledger.stations.Settlement;
import com.esgledger.stations.SettlementPlatform;
import com.esgledger.stations.Station;
import com.esgledger.stations.StationSettlementService;
import com.esgledger.stations.StationTransaction;
import com.esgledger.stations.TransactionReceipt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

/**
 * REST API for charging stations and operator settlements.
 */
@RestController
@RequestMapping("/api/v1/stations")
@RequiredArgsConstructor
@Tag(name = "Stations", description = "Charging station settlement API")
public class StationController {

    private final StationSettlementService settlementService;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Register a charging station")
    public ResponseEntity<Station> registerStation(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody RegisterStationRequest request) {
        Station station = settlementService.registerStation(
            callerId, request.getStationId(), request.getOperatorId(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(station);
    }

    @PostMapping("/{stationId}/deactivate")
    @Operation(summary = "Deactivate a station")
    public ResponseEntity<Station> deactivateStation(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String stationId) {
        return ResponseEntity.ok(settlementService.deactivateStation(callerId, stationId));
    }

    @GetMapping("/{stationId}")
    @Operation(summary = "Get station statistics")
    public ResponseEntity<Station> getStation(@PathVariable String stationId) {
        return ResponseEntity.ok(settlementService.getStation(stationId));
    }

    @GetMapping("/operator/{operatorId}")
    @Operation(summary = "List stations run by an operator")
    public ResponseEntity<List<Station>> getStationsByOperator(@PathVariable String operatorId) {
        return ResponseEntity.ok(settlementService.getStationsByOperator(operatorId));
    }

    @PostMapping("/{stationId}/transactions")
    @Operation(summary = "Record a gross charging transaction")
    public ResponseEntity<TransactionReceipt> recordTransaction(
            @PathVariable String stationId,
            @Valid @RequestBody StationTransactionRequest request) {
        TransactionReceipt receipt = settlementService.recordTransaction(
            stationId, request.getGrossAmount(), request.getExternalRef(), clock.instant());
        return ResponseEntity.ok(receipt);
    }

    @GetMapping("/{stationId}/transactions")
    @Operation(summary = "List recorded transactions of a station")
    public ResponseEntity<List<StationTransaction>> getTransactions(@PathVariable String stationId) {
        return ResponseEntity.ok(settlementService.getTransactions(stationId));
    }

    @PostMapping("/{stationId}/settlements")
    @Operation(summary = "Request settlement of pending revenue")
    public ResponseEntity<Settlement> requestSettlement(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String stationId,
            @Valid @RequestBody SettlementRequest request) {
        Settlement settlement = settlementService.requestSettlement(
            callerId, stationId, request.getSettlementId(), request.getPeriod(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(settlement);
    }

    @GetMapping("/{stationId}/settlements")
    @Operation(summary = "List settlements of a station")
    public ResponseEntity<List<Settlement>> getSettlements(@PathVariable String stationId) {
        return ResponseEntity.ok(settlementService.getSettlements(stationId));
    }

    @GetMapping("/settlements/{settlementId}")
    @Operation(summary = "Get settlement details")
    public ResponseEntity<Settlement> getSettlement(@PathVariable String settlementId) {
        return ResponseEntity.ok(settlementService.getSettlement(settlementId));
    }

    @PostMapping("/settlements/{settlementId}/approve")
    @Operation(summary = "Approve a requested settlement")
    public ResponseEntity<Settlement> approveSettlement(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String settlementId) {
        return ResponseEntity.ok(settlementService.approveSettlement(callerId, settlementId, clock.instant()));
    }

    @PostMapping("/settlements/{settlementId}/withdraw")
    @Operation(summary = "Withdraw an approved settlement to the operator")
    public ResponseEntity<Settlement> withdraw(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String settlementId) {
        return ResponseEntity.ok(settlementService.withdraw(callerId, settlementId, clock.instant()));
    }

    @GetMapping("/platform")
    @Operation(summary = "Get platform fee rate and totals")
    public ResponseEntity<SettlementPlatform> getPlatform() {
        return ResponseEntity.ok(settlementService.getPlatform());
    }

    @PutMapping("/platform/fee-rate")
    @Operation(summary = "Change the platform fee rate")
    public ResponseEntity<Void> setFeeRate(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam int feeRateBps) {
        settlementService.setFeeRateBps(callerId, feeRateBps);
        return ResponseEntity.ok().build();
    }
}
