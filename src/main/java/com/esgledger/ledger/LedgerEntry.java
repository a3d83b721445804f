package com.esgledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable journal entry for one balance movement.
 *
 * A mint has only a credited account, a burn only a debited account and a
 * transfer both. Entries are never updated or deleted - they are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_debit_account", columnList = "debit_account_id"),
    @Index(name = "idx_ledger_credit_account", columnList = "credit_account_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    private TransactionType transactionType;

    @Column(name = "debit_account_id")
    private String debitAccountId;

    @Column(name = "credit_account_id")
    private String creditAccountId;

    private long amount;

    /**
     * The grant that authorized a mint, null for burns and transfers.
     */
    private String grantId;

    private String memo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(TransactionType transactionType, String debitAccountId, String creditAccountId,
                       long amount, String grantId, String memo) {
        this.entryId = UUID.randomUUID().toString();
        this.transactionType = transactionType;
        this.debitAccountId = debitAccountId;
        this.creditAccountId = creditAccountId;
        this.amount = amount;
        this.grantId = grantId;
        this.memo = memo;
        this.createdAt = Instant.now();
    }
}
