package com.esgledger.stations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SettlementPlatformRepository extends JpaRepository<SettlementPlatform, String> {
}
