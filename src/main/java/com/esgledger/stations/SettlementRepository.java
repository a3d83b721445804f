package com.esgledger.stations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SettlementRepository extends JpaRepository<Settlement, String> {

    List<Settlement> findByStationIdOrderByRequestedAtDesc(String stationId);

    boolean existsByStationIdAndStatusIn(String stationId, Collection<SettlementStatus> statuses);
}
