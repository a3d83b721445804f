package com.esgledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger journal entries.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByDebitAccountIdOrCreditAccountIdOrderByCreatedAtDesc(String debitAccountId,
                                                                               String creditAccountId);

    List<LedgerEntry> findByTransactionType(TransactionType transactionType);
}
