package com.esgledger.rewards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RewardClaimRepository extends JpaRepository<RewardClaim, String> {

    List<RewardClaim> findByAccountIdOrderByClaimedAtDesc(String accountId);
}
