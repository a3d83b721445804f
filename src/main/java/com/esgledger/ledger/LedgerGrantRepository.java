package com.esgledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerGrantRepository extends JpaRepository<LedgerGrant, String> {

    boolean existsByIssuerAndSourceRef(GrantIssuer issuer, String sourceRef);
}
