package com.esgledger.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted record behind an {@link AuthorizationToken}.
 *
 * A grant authorizes exactly one privileged action and is consumed by it.
 * Tokens that do not name an unconsumed grant are rejected.
 */
@Entity
@Table(name = "ledger_grants", indexes = {
    @Index(name = "idx_grant_source_ref", columnList = "source_ref")
})
@Data
@NoArgsConstructor
public class LedgerGrant {

    @Id
    @Setter(AccessLevel.NONE)
    private String grantId;

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private GrantIssuer issuer;

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private GrantAction action;

    /**
     * Mint recipient or freeze target. Null for pause actions.
     */
    @Setter(AccessLevel.NONE)
    private String targetAccountId;

    /**
     * Mint amount. Zero for non-mint actions.
     */
    @Setter(AccessLevel.NONE)
    private long amount;

    /**
     * What the grant was issued for, e.g. a proposal or settlement id.
     */
    @Column(name = "source_ref")
    @Setter(AccessLevel.NONE)
    private String sourceRef;

    @Setter(AccessLevel.NONE)
    private boolean consumed;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "consumed_at")
    @Setter(AccessLevel.NONE)
    private Instant consumedAt;

    public LedgerGrant(GrantIssuer issuer, GrantAction action, String targetAccountId,
                       long amount, String sourceRef) {
        this.grantId = UUID.randomUUID().toString();
        this.issuer = issuer;
        this.action = action;
        this.targetAccountId = targetAccountId;
        this.amount = amount;
        this.sourceRef = sourceRef;
        this.consumed = false;
        this.createdAt = Instant.now();
    }

    public boolean matches(AuthorizationToken token) {
        return action == token.getAction()
            && issuer == token.getIssuer()
            && amount == token.getAmount()
            && Objects.equals(targetAccountId, token.getTargetAccountId());
    }

    void consume() {
        this.consumed = true;
        this.consumedAt = Instant.now();
    }

    public AuthorizationToken toToken() {
        return new AuthorizationToken(grantId, issuer, action, targetAccountId, amount);
    }
}
