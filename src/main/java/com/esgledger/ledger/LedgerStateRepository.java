package com.esgledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerStateRepository extends JpaRepository<LedgerState, String> {
}
