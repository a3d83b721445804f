package com.esgledger.ledger;

import com.esgledger.common.Amounts;
import com.esgledger.common.exception.AlreadyActiveException;
import com.esgledger.common.exception.FrozenException;
import com.esgledger.common.exception.InsufficientBalanceException;
import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.common.exception.PausedException;
import com.esgledger.common.exception.RecordNotFoundException;
import com.esgledger.common.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service owning all account balances and the total supply.
 *
 * Every balance change in the system goes through mint, burn or transfer
 * here, and each one is written to the append-only journal. Preconditions
 * are checked before the first mutation; a failure rolls back the whole
 * transaction, so a half-applied movement is never visible.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccountRepository accountRepository;
    private final LedgerStateRepository stateRepository;
    private final LedgerEntryRepository entryRepository;
    private final LedgerGrantRepository grantRepository;
    private final List<GrantSource> grantSources;

    @Value("${esg-ledger.admin-id:platform-admin}")
    private String configuredAdminId;

    /**
     * System account holding escrowed funds. No participant may act as it.
     */
    @Value("${esg-ledger.escrow.holding-account:escrow-holding}")
    private String reservedAccountId;

    /**
     * Initialize an account with a zero balance.
     *
     * Re-opting-in an existing account is allowed only while its balance is
     * zero; the frozen flag survives, so opt-in cannot be used to thaw.
     */
    @Transactional
    public Account optIn(String accountId) {
        requireNotReserved(accountId, "opt in");
        Optional<Account> existing = accountRepository.findById(accountId);
        if (existing.isPresent()) {
            Account account = existing.get();
            if (account.getBalance() != 0) {
                throw new AlreadyActiveException(accountId, account.getBalance());
            }
            log.info("Account {} re-opted in", accountId);
            return account;
        }

        Account account = accountRepository.save(new Account(accountId));
        log.info("Account {} opted in", accountId);
        return account;
    }

    /**
     * Opt in an internal account if it does not exist yet. Never fails.
     */
    @Transactional
    public Account ensureOptedIn(String accountId) {
        return accountRepository.findById(accountId)
            .orElseGet(() -> {
                log.info("Opening internal account {}", accountId);
                return accountRepository.save(new Account(accountId));
            });
    }

    /**
     * Remove an account. Only an empty account can be closed.
     */
    @Transactional
    public void closeOut(String accountId) {
        requireNotReserved(accountId, "close out");
        Account account = getAccount(accountId);
        if (account.getBalance() != 0) {
            throw new InvalidStateException(
                String.format("Cannot close account %s with balance %d", accountId, account.getBalance()));
        }
        accountRepository.delete(account);
        log.info("Account {} closed out", accountId);
    }

    /**
     * Issue a single-use grant for a privileged ledger action.
     *
     * Only governance may issue pause and freeze grants; the internal
     * components may only authorize mints of their own payouts. Every grant
     * must be vouched for by its issuer's {@link GrantSource}, and each
     * source record backs at most one grant.
     *
     * @throws UnauthorizedException if no source record authorizes the grant
     */
    @Transactional
    public AuthorizationToken issueGrant(GrantIssuer issuer, GrantAction action, String targetAccountId,
                                         long amount, String sourceRef) {
        if (action != GrantAction.MINT && issuer != GrantIssuer.GOVERNANCE) {
            throw new UnauthorizedException(issuer.name(), "issue " + action + " grant");
        }
        if (action == GrantAction.MINT) {
            Amounts.requirePositive(amount, "Mint amount");
        }
        if (sourceRef == null || grantRepository.existsByIssuerAndSourceRef(issuer, sourceRef)) {
            throw new UnauthorizedException(
                String.format("%s source %s cannot back another grant", issuer, sourceRef));
        }
        sourceFor(issuer).verify(action, targetAccountId, amount, sourceRef);

        LedgerGrant grant = grantRepository.save(
            new LedgerGrant(issuer, action, targetAccountId, amount, sourceRef));

        log.info("Issued {} grant {} by {} for {} amount={} (source={})",
            action, grant.getGrantId(), issuer, targetAccountId, amount, sourceRef);

        return grant.toToken();
    }

    /**
     * Mint new tokens to an opted-in account.
     *
     * @param token a grant issued for exactly this recipient and amount
     * @throws PausedException if the ledger is paused
     * @throws UnauthorizedException if the token does not name an unconsumed matching grant
     */
    @Transactional
    public Account mint(String recipientId, long amount, AuthorizationToken token) {
        Amounts.requirePositive(amount, "Mint amount");

        LedgerState state = loadStateForUpdate();
        if (state.isPaused()) {
            throw new PausedException("mint");
        }

        LedgerGrant grant = requireGrant(token, GrantAction.MINT);
        if (!recipientId.equals(grant.getTargetAccountId()) || amount != grant.getAmount()) {
            throw new UnauthorizedException(
                String.format("Grant %s does not authorize minting %d to %s",
                    grant.getGrantId(), amount, recipientId));
        }

        Account recipient = getAccount(recipientId);
        Amounts.add(recipient.getBalance(), amount, "Recipient balance");
        Amounts.add(state.getTotalSupply(), amount, "Total supply");

        recipient.credit(amount);
        state.increaseSupply(amount);
        grant.consume();

        accountRepository.save(recipient);
        stateRepository.save(state);
        grantRepository.save(grant);
        entryRepository.save(new LedgerEntry(
            TransactionType.MINT, null, recipientId, amount, grant.getGrantId(),
            "Mint by " + grant.getIssuer()));

        log.info("Minted {} to {} (grant={}, issuer={}, supply={})",
            amount, recipientId, grant.getGrantId(), grant.getIssuer(), state.getTotalSupply());

        return recipient;
    }

    /**
     * Check that {@code amount} could be minted to {@code recipientId} right now,
     * so callers can validate before recording what the mint pays for.
     *
     * @throws PausedException if the ledger is paused
     * @throws RecordNotFoundException if the recipient has not opted in
     */
    @Transactional(readOnly = true)
    public void requireMintable(String recipientId, long amount) {
        Amounts.requirePositive(amount, "Mint amount");
        LedgerState state = loadState();
        if (state.isPaused()) {
            throw new PausedException("mint");
        }
        Account recipient = getAccount(recipientId);
        Amounts.add(recipient.getBalance(), amount, "Recipient balance");
        Amounts.add(state.getTotalSupply(), amount, "Total supply");
    }

    /**
     * Destroy tokens held by an account.
     */
    @Transactional
    public Account burn(String holderId, long amount) {
        Amounts.requirePositive(amount, "Burn amount");
        requireNotReserved(holderId, "burn");

        LedgerState state = loadStateForUpdate();
        if (state.isPaused()) {
            throw new PausedException("burn");
        }

        Account holder = getAccount(holderId);
        if (holder.getBalance() < amount) {
            throw new InsufficientBalanceException(holderId, amount, holder.getBalance());
        }

        holder.debit(amount);
        state.decreaseSupply(amount);

        accountRepository.save(holder);
        stateRepository.save(state);
        entryRepository.save(new LedgerEntry(
            TransactionType.BURN, holderId, null, amount, null, "Burn"));

        log.info("Burned {} from {} (supply={})", amount, holderId, state.getTotalSupply());

        return holder;
    }

    /**
     * Move tokens between two opted-in accounts.
     */
    @Transactional
    public void transfer(String senderId, String recipientId, long amount) {
        transfer(senderId, recipientId, amount, "Transfer");
    }

    /**
     * Move tokens between two opted-in accounts, with a journal memo.
     *
     * @throws PausedException if the ledger is paused
     * @throws FrozenException if the sender is frozen
     * @throws InsufficientBalanceException if the sender cannot cover the amount
     */
    @Transactional
    public void transfer(String senderId, String recipientId, long amount, String memo) {
        Amounts.requirePositive(amount, "Transfer amount");

        LedgerState state = loadState();
        if (state.isPaused()) {
            throw new PausedException("transfer");
        }

        Account sender = getAccount(senderId);
        Account recipient = getAccount(recipientId);

        if (sender.isFrozen()) {
            throw new FrozenException(senderId);
        }
        if (sender.getBalance() < amount) {
            throw new InsufficientBalanceException(senderId, amount, sender.getBalance());
        }
        if (!senderId.equals(recipientId)) {
            Amounts.add(recipient.getBalance(), amount, "Recipient balance");
        }

        sender.debit(amount);
        recipient.credit(amount);

        accountRepository.save(sender);
        accountRepository.save(recipient);
        entryRepository.save(new LedgerEntry(
            TransactionType.TRANSFER, senderId, recipientId, amount, null, memo));

        log.info("Transferred {} from {} to {}", amount, senderId, recipientId);
    }

    @Transactional
    public void setPaused(String callerId, boolean paused) {
        requireAdmin(callerId, paused ? "pause" : "unpause");
        applyPause(paused);
    }

    @Transactional
    public void setFrozen(String callerId, String accountId, boolean frozen) {
        requireAdmin(callerId, frozen ? "freeze" : "unfreeze");
        applyFreeze(accountId, frozen);
    }

    /**
     * Apply a pause or freeze action authorized by an executed committee proposal.
     */
    @Transactional
    public void applyGovernanceAction(AuthorizationToken token) {
        if (token.getAction() == GrantAction.MINT) {
            throw new UnauthorizedException("Mint grants must be presented to mint");
        }

        LedgerGrant grant = requireGrant(token, token.getAction());
        if (grant.getIssuer() != GrantIssuer.GOVERNANCE) {
            throw new UnauthorizedException(grant.getIssuer().name(), "apply " + grant.getAction());
        }

        switch (grant.getAction()) {
            case PAUSE -> applyPause(true);
            case UNPAUSE -> applyPause(false);
            case FREEZE -> applyFreeze(grant.getTargetAccountId(), true);
            case UNFREEZE -> applyFreeze(grant.getTargetAccountId(), false);
            default -> throw new IllegalStateException("Unexpected action " + grant.getAction());
        }

        grant.consume();
        grantRepository.save(grant);
    }

    /**
     * Check the caller against the configured admin identity.
     *
     * @throws UnauthorizedException if the caller is not the admin
     */
    @Transactional(readOnly = true)
    public void requireAdmin(String callerId, String operation) {
        if (!isAdmin(callerId)) {
            log.info("Rejected '{}' by non-admin caller {}", operation, callerId);
            throw new UnauthorizedException(callerId, operation);
        }
    }

    /**
     * Reject participant actions under the identity of a system account.
     *
     * @throws UnauthorizedException if {@code accountId} is reserved
     */
    public void requireNotReserved(String accountId, String operation) {
        if (isReservedAccount(accountId)) {
            throw new UnauthorizedException(accountId, operation + " as a reserved system account");
        }
    }

    public boolean isReservedAccount(String accountId) {
        return reservedAccountId.equals(accountId);
    }

    @Transactional(readOnly = true)
    public boolean isAdmin(String callerId) {
        return callerId != null && callerId.equals(loadState().getAdminId());
    }

    /**
     * Look up the token for a previously issued grant, for callers that only hold its id.
     */
    @Transactional(readOnly = true)
    public AuthorizationToken getGrantToken(String grantId) {
        return grantRepository.findById(grantId)
            .map(LedgerGrant::toToken)
            .orElseThrow(() -> new UnauthorizedException("Unknown grant: " + grantId));
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new RecordNotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public long getBalance(String accountId) {
        return getAccount(accountId).getBalance();
    }

    @Transactional(readOnly = true)
    public long getTotalSupply() {
        return loadState().getTotalSupply();
    }

    @Transactional(readOnly = true)
    public boolean isPaused() {
        return loadState().isPaused();
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountJournal(String accountId) {
        return entryRepository.findByDebitAccountIdOrCreditAccountIdOrderByCreatedAtDesc(accountId, accountId);
    }

    @Transactional(readOnly = true)
    public LedgerState getState() {
        return loadState();
    }

    private void applyPause(boolean paused) {
        LedgerState state = loadStateForUpdate();
        state.pause(paused);
        stateRepository.save(state);
        log.info("Ledger {}", paused ? "paused" : "unpaused");
    }

    private void applyFreeze(String accountId, boolean frozen) {
        Account account = getAccount(accountId);
        account.setFrozenFlag(frozen);
        accountRepository.save(account);
        log.info("Account {} {}", accountId, frozen ? "frozen" : "unfrozen");
    }

    private GrantSource sourceFor(GrantIssuer issuer) {
        return grantSources.stream()
            .filter(source -> source.getIssuer() == issuer)
            .findFirst()
            .orElseThrow(() -> new UnauthorizedException("No grant source registered for " + issuer));
    }

    private LedgerGrant requireGrant(AuthorizationToken token, GrantAction expectedAction) {
        if (token == null) {
            throw new UnauthorizedException("No authorization token presented for " + expectedAction);
        }
        LedgerGrant grant = grantRepository.findById(token.getGrantId())
            .orElseThrow(() -> new UnauthorizedException("Unknown grant: " + token.getGrantId()));
        if (grant.isConsumed()) {
            throw new UnauthorizedException("Grant already used: " + grant.getGrantId());
        }
        if (grant.getAction() != expectedAction || !grant.matches(token)) {
            throw new UnauthorizedException("Token does not match grant: " + grant.getGrantId());
        }
        return grant;
    }

    private LedgerState loadState() {
        return stateRepository.findById(LedgerState.SINGLETON_ID)
            .orElseGet(() -> new LedgerState(configuredAdminId));
    }

    private LedgerState loadStateForUpdate() {
        return stateRepository.findById(LedgerState.SINGLETON_ID)
            .orElseGet(() -> stateRepository.save(new LedgerState(configuredAdminId)));
    }
}
