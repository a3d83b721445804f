package com.esgledger.ledger;

import com.esgledger.common.exception.InsufficientBalanceException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A participant's token account.
 *
 * The balance is only ever changed through {@link LedgerService}; there is
 * no public setter and the credit/debit methods are package-private.
 */
@Entity
@Table(name = "ledger_accounts")
@Data
@NoArgsConstructor
public class Account {

    @Id
    private String accountId;

    /**
     * Balance in the smallest token unit. Never negative.
     */
    @Setter(AccessLevel.NONE)
    private long balance;

    /**
     * A frozen account cannot send funds. It can still receive them.
     */
    @Setter(AccessLevel.NONE)
    private boolean frozen;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Account(String accountId) {
        this.accountId = accountId;
        this.balance = 0L;
        this.frozen = false;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    void credit(long amount) {
        this.balance = Math.addExact(this.balance, amount);
        this.updatedAt = Instant.now();
    }

    void debit(long amount) {
        if (balance < amount) {
            throw new InsufficientBalanceException(accountId, amount, balance);
        }
        this.balance -= amount;
        this.updatedAt = Instant.now();
    }

    void setFrozenFlag(boolean frozen) {
        this.frozen = frozen;
        this.updatedAt = Instant.now();
    }
}
