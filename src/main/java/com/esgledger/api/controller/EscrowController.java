package com.esgledger.api.controller;

import com.esgledger.api.dto.CreateEscrowRequest;
import com.esgledger.api.dto.DisputeRequest;
import com.esgledger.escrow.DisputeResolution;
import com.esgledger.escrow.Escrow;
import com.esgledger.escrow.EscrowBook;
import com.esgledger.escrow.EscrowService;
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
 * REST API for enterprise escrows.
 */
@RestController
@RequestMapping("/api/v1/escrows")
@RequiredArgsConstructor
@Tag(name = "Escrows", description = "Enterprise escrow API")
public class EscrowController {

    private final EscrowService escrowService;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Create an escrow")
    public ResponseEntity<Escrow> createEscrow(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody CreateEscrowRequest request) {
        Escrow escrow = escrowService.createEscrow(callerId, request.getEscrowId(), request.getBuyerId(),
            request.getSellerId(), request.getAmount(), request.getContractHash(), request.getDeadline(),
            clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(escrow);
    }

    @GetMapping("/{escrowId}")
    @Operation(summary = "Get escrow details")
    public ResponseEntity<Escrow> getEscrow(@PathVariable String escrowId) {
        return ResponseEntity.ok(escrowService.getEscrow(escrowId));
    }

    @GetMapping("/party/{accountId}")
    @Operation(summary = "List escrows where the account is buyer or seller")
    public ResponseEntity<List<Escrow>> getEscrowsFor(@PathVariable String accountId) {
        return ResponseEntity.ok(escrowService.getEscrowsFor(accountId));
    }

    @PostMapping("/{escrowId}/deposit")
    @Operation(summary = "Deposit the escrow amount from the buyer")
    public ResponseEntity<Escrow> deposit(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId) {
        return ResponseEntity.ok(escrowService.depositFunds(callerId, escrowId, clock.instant()));
    }

    @PostMapping("/{escrowId}/shipment")
    @Operation(summary = "Seller confirms shipment")
    public ResponseEntity<Escrow> confirmShipment(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId,
            @RequestParam(required = false) String shipmentRef) {
        return ResponseEntity.ok(escrowService.confirmShipment(callerId, escrowId, shipmentRef));
    }

    @PostMapping("/{escrowId}/receipt")
    @Operation(summary = "Buyer confirms receipt")
    public ResponseEntity<Escrow> confirmReceipt(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId,
            @RequestParam(required = false) String receiptRef) {
        return ResponseEntity.ok(escrowService.confirmReceipt(callerId, escrowId, receiptRef));
    }

    @PostMapping("/{escrowId}/release")
    @Operation(summary = "Release escrowed funds to the seller")
    public ResponseEntity<Escrow> release(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId) {
        return ResponseEntity.ok(escrowService.releaseFunds(callerId, escrowId, clock.instant()));
    }

    @PostMapping("/{escrowId}/dispute")
    @Operation(summary = "Raise a dispute")
    public ResponseEntity<Escrow> raiseDispute(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId,
            @Valid @RequestBody DisputeRequest request) {
        return ResponseEntity.ok(escrowService.raiseDispute(callerId, escrowId, request.getReason()));
    }

    @PostMapping("/{escrowId}/resolve")
    @Operation(summary = "Resolve a dispute")
    public ResponseEntity<Escrow> resolveDispute(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId,
            @RequestParam DisputeResolution resolution) {
        return ResponseEntity.ok(escrowService.resolveDispute(callerId, escrowId, resolution, clock.instant()));
    }

    @PostMapping("/{escrowId}/cancel")
    @Operation(summary = "Cancel an escrow and refund the buyer")
    public ResponseEntity<Escrow> cancel(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String escrowId) {
        return ResponseEntity.ok(escrowService.cancelEscrow(callerId, escrowId, clock.instant()));
    }

    @GetMapping("/book")
    @Operation(summary = "Get escrow totals and arbitration fee")
    public ResponseEntity<EscrowBook> getBook() {
        return ResponseEntity.ok(escrowService.getBook());
    }

    @PutMapping("/book/arbitration-fee")
    @Operation(summary = "Change the arbitration fee")
    public ResponseEntity<Void> setArbitrationFee(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam long arbitrationFee) {
        escrowService.setArbitrationFee(callerId, arbitrationFee);
        return ResponseEntity.ok().build();
    }
}
