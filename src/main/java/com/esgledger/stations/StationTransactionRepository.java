package com.esgledger.stations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StationTransactionRepository extends JpaRepository<StationTransaction, String> {

    List<StationTransaction> findByStationIdOrderByRecordedAtDesc(String stationId);
}
