package com.esgledger.api.controller;

import com.esgledger.api.dto.ProposalRequest;
import com.esgledger.governance.CommitteeMember;
import com.esgledger.governance.GovernanceService;
import com.esgledger.governance.Proposal;
import com.esgledger.governance.ProposalExecution;
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
 * REST API for the governance committee and its proposals.
 */
@RestController
@RequestMapping("/api/v1/governance")
@RequiredArgsConstructor
@Tag(name = "Governance", description = "Committee multisig API")
public class GovernanceController {

    private final GovernanceService governanceService;
    private final Clock clock;

    @PostMapping("/members/{memberId}")
    @Operation(summary = "Add a committee member")
    public ResponseEntity<CommitteeMember> addMember(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String memberId) {
        CommitteeMember member = governanceService.addMember(callerId, memberId);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @DeleteMapping("/members/{memberId}")
    @Operation(summary = "Remove a committee member")
    public ResponseEntity<Void> removeMember(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String memberId) {
        governanceService.removeMember(callerId, memberId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/members")
    @Operation(summary = "List committee members")
    public ResponseEntity<List<CommitteeMember>> getMembers() {
        return ResponseEntity.ok(governanceService.getMembers());
    }

    @PostMapping("/proposals")
    @Operation(summary = "Submit a proposal")
    public ResponseEntity<Proposal> propose(
            @RequestHeader("X-Caller-Id") String callerId,
            @Valid @RequestBody ProposalRequest request) {
        Proposal proposal = governanceService.propose(callerId, request.getProposalId(),
            request.getType(), request.getPayload(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(proposal);
    }

    @PostMapping("/proposals/{proposalId}/votes")
    @Operation(summary = "Vote on a proposal")
    public ResponseEntity<Proposal> vote(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String proposalId,
            @RequestParam(defaultValue = "true") boolean approve) {
        return ResponseEntity.ok(governanceService.vote(callerId, proposalId, approve, clock.instant()));
    }

    @PostMapping("/proposals/{proposalId}/execute")
    @Operation(summary = "Execute an approved proposal")
    public ResponseEntity<ProposalExecution> execute(
            @RequestHeader("X-Caller-Id") String callerId,
            @PathVariable String proposalId) {
        return ResponseEntity.ok(governanceService.execute(callerId, proposalId, clock.instant()));
    }

    @GetMapping("/proposals/{proposalId}")
    @Operation(summary = "Get proposal details")
    public ResponseEntity<Proposal> getProposal(@PathVariable String proposalId) {
        return ResponseEntity.ok(governanceService.getProposal(proposalId));
    }

    @GetMapping("/proposals")
    @Operation(summary = "List proposals not yet executed")
    public ResponseEntity<List<Proposal>> getOpenProposals() {
        return ResponseEntity.ok(governanceService.getOpenProposals());
    }

    @GetMapping("/required-approvals")
    @Operation(summary = "Get the approval quorum")
    public ResponseEntity<Integer> getRequiredApprovals() {
        return ResponseEntity.ok(governanceService.getRequiredApprovals());
    }

    @PutMapping("/required-approvals")
    @Operation(summary = "Change the approval quorum")
    public ResponseEntity<Void> setRequiredApprovals(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam int requiredApprovals) {
        governanceService.setRequiredApprovals(callerId, requiredApprovals);
        return ResponseEntity.ok().build();
    }
}
