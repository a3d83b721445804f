package com.esgledger.rewards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RewardPoolRepository extends JpaRepository<RewardPool, String> {
}
