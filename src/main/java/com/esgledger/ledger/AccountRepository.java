package com.esgledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repository for ledger accounts.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    @Query("select coalesce(sum(a.balance), 0) from Account a")
    long sumBalances();
}
