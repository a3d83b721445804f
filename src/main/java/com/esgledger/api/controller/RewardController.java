package com.esgledger.api.controller;

import com.esgledger.api.dto.CarbonActivityRequest;
import com.esgledger.rewards.CarbonActivity;
import com.esgledger.rewards.RewardClaim;
import com.esgledger.rewards.RewardPool;
import com.esgledger.rewards.RewardProfile;
import com.esgledger.rewards.RewardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * REST API for carbon reduction rewards.
 */
@RestController
@RequestMapping("/api/v1/rewards")
@RequiredArgsConstructor
@Tag(name = "Rewards", description = "Carbon reward accrual API")
public class RewardController {

    private final RewardService rewardService;
    private final Clock clock;

    @PostMapping("/activities")
    @Operation(summary = "Register a verified carbon reduction")
    public ResponseEntity<RewardProfile> registerActivity(@Valid @RequestBody CarbonActivityRequest request) {
        RewardProfile profile = rewardService.registerActivity(
            request.getAccountId(), request.getCarbonKg(), request.getActivityRef(), clock.instant());
        return ResponseEntity.ok(profile);
    }

    @PostMapping("/claim")
    @Operation(summary = "Claim all pending rewards of the caller")
    public ResponseEntity<Map<String, Long>> claim(@RequestHeader("X-Caller-Id") String callerId) {
        long claimed = rewardService.claim(callerId);
        return ResponseEntity.ok(Map.of("claimed", claimed));
    }

    @GetMapping("/profiles/{accountId}")
    @Operation(summary = "Get reward profile")
    public ResponseEntity<RewardProfile> getProfile(@PathVariable String accountId) {
        return ResponseEntity.ok(rewardService.getProfile(accountId));
    }

    @GetMapping("/profiles/{accountId}/activities")
    @Operation(summary = "Get registered activities of an account")
    public ResponseEntity<List<CarbonActivity>> getActivities(@PathVariable String accountId) {
        return ResponseEntity.ok(rewardService.getActivities(accountId));
    }

    @GetMapping("/profiles/{accountId}/claims")
    @Operation(summary = "Get settled claims of an account")
    public ResponseEntity<List<RewardClaim>> getClaims(@PathVariable String accountId) {
        return ResponseEntity.ok(rewardService.getClaims(accountId));
    }

    @GetMapping("/pool")
    @Operation(summary = "Get reward rate and total distributed")
    public ResponseEntity<RewardPool> getPool() {
        return ResponseEntity.ok(rewardService.getPool());
    }

    @PutMapping("/rate")
    @Operation(summary = "Change the reward rate")
    public ResponseEntity<Void> setRewardRate(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestParam long rewardRate) {
        rewardService.setRewardRate(callerId, rewardRate);
        return ResponseEntity.ok().build();
    }
}
