package com.esgledger.api.controller;

import com.esgledger.api.dto.BurnRequest;
import com.esgledger.api.dto.MintRequest;
import com.esgledger.api.dto.OptInRequest;
import com.esgledger.api.dto.TransferRequest;
import com.esgledger.ledger.Account;
import com.esgledger.ledger.AuthorizationToken;
import com.esgledger.ledger.LedgerEntry;
import com.esgledger.ledger.LedgerService;
import com.esgledger.ledger.LedgerState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for token accounts and balance movements.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Token ledger API")
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/accounts")
    @Operation(summary = "Opt an account in to the ledger")
    public ResponseEntity<Account> optIn(@Valid @RequestBody OptInRequest request) {
        Account account = ledgerService.optIn(request.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @DeleteMapping("/accounts/{accountId}")
    @Operation(summary = "Close out an empty account")
    public ResponseEntity<Void> closeOut(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String accountId) {
        if (!callerId.equals(accountId)) {
            ledgerService.requireAdmin(callerId, "close out " + accountId);
        }
        ledgerService.closeOut(accountId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/accounts/{accountId}")
    @Operation(summary = "Get account balance and status")
    public ResponseEntity<Account> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccount(accountId));
    }

    @GetMapping("/accounts/{accountId}/journal")
    @Operation(summary = "Get journal entries for an account")
    public ResponseEntity<List<LedgerEntry>> getJournal(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccountJournal(accountId));
    }

    @GetMapping("/supply")
    @Operation(summary = "Get total supply and pause state")
    public ResponseEntity<LedgerState> getSupply() {
        return ResponseEntity.ok(ledgerService.getState());
    }

    @PostMapping("/mint")
    @Operation(summary = "Mint tokens against an issued grant")
    public ResponseEntity<Account> mint(@Valid @RequestBody MintRequest request) {
        AuthorizationToken token = ledgerService.getGrantToken(request.getGrantId());
        Account account = ledgerService.mint(request.getRecipientId(), request.getAmount(), token);
        return ResponseEntity.ok(account);
    }

    @PostMapping("/burn")
    @Operation(summary = "Burn tokens held by the caller")
    public ResponseEntity<Account> burn(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody BurnRequest request) {
        return ResponseEntity.ok(ledgerService.burn(callerId, request.getAmount()));
    }

    @PostMapping("/transfer")
    @Operation(summary = "Transfer tokens from the caller")
    public ResponseEntity<Void> transfer(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody TransferRequest request) {
        ledgerService.requireNotReserved(callerId, "transfer");
        String memo = request.getMemo() != null ? request.getMemo() : "Transfer";
        ledgerService.transfer(callerId, request.getRecipientId(), request.getAmount(), memo);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause")
    @Operation(summary = "Pause or unpause all balance movements")
    public ResponseEntity<Void> setPaused(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam boolean paused) {
        ledgerService.setPaused(callerId, paused);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/accounts/{accountId}/freeze")
    @Operation(summary = "Freeze or unfreeze an account")
    public ResponseEntity<Void> setFrozen(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String accountId,
            @RequestParam boolean frozen) {
        ledgerService.setFrozen(callerId, accountId, frozen);
        return ResponseEntity.ok().build();
    }
}
