package com.esgledger.rewards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CarbonActivityRepository extends JpaRepository<CarbonActivity, String> {

    List<CarbonActivity> findByAccountIdOrderByRecordedAtDesc(String accountId);
}
