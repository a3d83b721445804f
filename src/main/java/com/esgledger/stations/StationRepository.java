package com.esgledger.stations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for charging stations.
 */
@Repository
public interface StationRepository extends JpaRepository<Station, String> {

    List<Station> findByOperatorId(String operatorId);
}
