package com.esgledger.ledger;

import com.esgledger.common.exception.AlreadyActiveException;
import com.esgledger.common.exception.FrozenException;
import com.esgledger.common.exception.InsufficientBalanceException;
import com.esgledger.common.exception.InvalidAmountException;
import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.common.exception.PausedException;
import com.esgledger.common.exception.RecordNotFoundException;
import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.governance.GovernanceService;
import com.esgledger.governance.ProposalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for balance movements and ledger holds.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LedgerServiceTest {

    private static final String ADMIN = "test-admin";
    private static final String MINTER = "minter";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private LedgerEntryRepository entryRepository;

    @Autowired
    private GovernanceService governanceService;

    private int proposalCount;

    @BeforeEach
    void setUp() {
        ledgerService.optIn("alice");
        ledgerService.optIn("bob");
        governanceService.addMember(ADMIN, MINTER);
        governanceService.setRequiredApprovals(ADMIN, 1);
    }

    private AuthorizationToken grantMint(String accountId, long amount) {
        String proposalId = "mint-" + (++proposalCount);
        String payload = String.format("{\"recipient\":\"%s\",\"amount\":%d}", accountId, amount);
        governanceService.propose(MINTER, proposalId, ProposalType.MINT, payload, NOW);
        return governanceService.execute(MINTER, proposalId, NOW).getGrant();
    }

    private void mintTo(String accountId, long amount) {
        ledgerService.mint(accountId, amount, grantMint(accountId, amount));
    }

    private void assertConserved() {
        assertEquals(ledgerService.getTotalSupply(), accountRepository.sumBalances());
    }

    @Test
    void testOptInStartsEmpty() {
        Account account = ledgerService.getAccount("alice");
        assertEquals(0L, account.getBalance());
        assertFalse(account.isFrozen());
    }

    @Test
    void testReOptInWithBalanceRejected() {
        mintTo("alice", 500L);

        AlreadyActiveException e = assertThrows(AlreadyActiveException.class,
            () -> ledgerService.optIn("alice"));
        assertTrue(e.getMessage().contains("alice"));
        assertEquals(500L, ledgerService.getBalance("alice"));
    }

    @Test
    void testReOptInWithZeroBalanceKeepsFrozenFlag() {
        ledgerService.setFrozen(ADMIN, "alice", true);

        Account account = ledgerService.optIn("alice");

        assertTrue(account.isFrozen());
    }

    @Test
    void testMintThroughGovernanceIsJournaled() {
        mintTo("alice", 1000L);

        LedgerEntry entry = entryRepository.findByTransactionType(TransactionType.MINT).get(0);
        assertEquals("alice", entry.getCreditAccountId());
        assertEquals("Mint by GOVERNANCE", entry.getMemo());
    }

    @Test
    void testMintIncreasesBalanceAndSupply() {
        mintTo("alice", 1000L);

        assertEquals(1000L, ledgerService.getBalance("alice"));
        assertEquals(1000L, ledgerService.getTotalSupply());
        assertConserved();
    }

    @Test
    void testMintGrantIsSingleUse() {
        AuthorizationToken token = grantMint("alice", 700L);
        ledgerService.mint("alice", 700L, token);

        assertThrows(UnauthorizedException.class, () -> ledgerService.mint("alice", 700L, token));
        assertEquals(700L, ledgerService.getTotalSupply());
    }

    @Test
    void testMintRejectsForgedOrMismatchedToken() {
        AuthorizationToken forged = new AuthorizationToken(
            "no-such-grant", GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 100L);
        assertThrows(UnauthorizedException.class, () -> ledgerService.mint("alice", 100L, forged));

        AuthorizationToken token = grantMint("alice", 100L);
        assertThrows(UnauthorizedException.class, () -> ledgerService.mint("bob", 100L, token));
        assertThrows(UnauthorizedException.class, () -> ledgerService.mint("alice", 200L, token));
        assertThrows(UnauthorizedException.class, () -> ledgerService.mint("alice", 100L, null));

        assertEquals(0L, ledgerService.getTotalSupply());
    }

    @Test
    void testOnlyGovernanceIssuesHoldGrants() {
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.REWARD_ACCRUAL, GrantAction.PAUSE, null, 0L, "test"));
    }

    @Test
    void testSelfDeclaredGovernanceGrantRejected() {
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 1_000_000L, "made-up"));
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.PAUSE, null, 0L, "made-up"));

        assertEquals(0L, ledgerService.getTotalSupply());
        assertFalse(ledgerService.isPaused());
    }

    @Test
    void testGovernanceGrantNeedsMatchingExecutedProposal() {
        governanceService.propose(MINTER, "open", ProposalType.MINT,
            "{\"recipient\":\"alice\",\"amount\":500}", NOW);
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 500L, "open"));

        governanceService.propose(MINTER, "note", ProposalType.TEXT, "quarterly report", NOW);
        governanceService.execute(MINTER, "note", NOW);
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 500L, "note"));
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.PAUSE, null, 0L, "note"));

        assertEquals(0L, ledgerService.getTotalSupply());
        assertFalse(ledgerService.isPaused());
    }

    @Test
    void testExecutedProposalBacksOnlyOneGrant() {
        AuthorizationToken token = grantMint("alice", 300L);
        String proposalId = "mint-" + proposalCount;

        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 300L, proposalId));

        ledgerService.mint("alice", 300L, token);
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.GOVERNANCE, GrantAction.MINT, "alice", 300L, proposalId));
        assertEquals(300L, ledgerService.getTotalSupply());
    }

    @Test
    void testInternalIssuersNeedTheirPayoutRecord() {
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.REWARD_ACCRUAL, GrantAction.MINT, "alice", 100L, "reward-claim:alice"));
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.STATION_SETTLEMENT, GrantAction.MINT, "alice", 100L, "no-such-settlement"));
        assertThrows(UnauthorizedException.class, () -> ledgerService.issueGrant(
            GrantIssuer.STATION_SETTLEMENT, GrantAction.MINT, "alice", 100L, null));
    }

    @Test
    void testStoredGrantCannotBeReopened() {
        for (String setter : List.of("setConsumed", "setConsumedAt", "setAmount", "setTargetAccountId",
                "setIssuer", "setAction", "setSourceRef", "setGrantId")) {
            assertTrue(Arrays.stream(LedgerGrant.class.getMethods())
                    .noneMatch(m -> m.getName().equals(setter)),
                setter + " should not be exposed");
        }
    }

    @Test
    void testApplyGovernanceActionRejectsReplayedHoldGrant() {
        governanceService.propose(MINTER, "halt", ProposalType.PAUSE, null, NOW);
        governanceService.execute(MINTER, "halt", NOW);
        governanceService.propose(MINTER, "resume", ProposalType.UNPAUSE, null, NOW);
        governanceService.execute(MINTER, "resume", NOW);
        assertFalse(ledgerService.isPaused());

        String haltGrant = governanceService.getProposal("halt").getGrantId();
        AuthorizationToken replay = ledgerService.getGrantToken(haltGrant);

        assertThrows(UnauthorizedException.class, () -> ledgerService.applyGovernanceAction(replay));
        assertFalse(ledgerService.isPaused());
    }

    @Test
    void testReservedHoldingAccountCannotActAsParticipant() {
        assertThrows(UnauthorizedException.class, () -> ledgerService.optIn("escrow-holding"));

        ledgerService.ensureOptedIn("escrow-holding");
        assertThrows(UnauthorizedException.class, () -> ledgerService.burn("escrow-holding", 1L));
        assertThrows(UnauthorizedException.class, () -> ledgerService.closeOut("escrow-holding"));
        assertTrue(ledgerService.isReservedAccount("escrow-holding"));
        assertFalse(ledgerService.isReservedAccount("alice"));
    }

    @Test
    void testMintToUnknownAccountFails() {
        AuthorizationToken token = grantMint("carol", 100L);

        assertThrows(RecordNotFoundException.class, () -> ledgerService.mint("carol", 100L, token));
    }

    @Test
    void testTransferMovesBalance() {
        mintTo("alice", 1000L);

        ledgerService.transfer("alice", "bob", 400L);

        assertEquals(600L, ledgerService.getBalance("alice"));
        assertEquals(400L, ledgerService.getBalance("bob"));
        assertConserved();
    }

    @Test
    void testTransferBeyondBalanceFailsWithoutEffect() {
        mintTo("alice", 100L);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> ledgerService.transfer("alice", "bob", 101L));
        assertTrue(e.getMessage().contains("alice"));

        assertEquals(100L, ledgerService.getBalance("alice"));
        assertEquals(0L, ledgerService.getBalance("bob"));
    }

    @Test
    void testZeroAmountRejected() {
        assertThrows(InvalidAmountException.class, () -> ledgerService.transfer("alice", "bob", 0L));
        assertThrows(InvalidAmountException.class, () -> ledgerService.burn("alice", -5L));
    }

    @Test
    void testBurnReducesSupply() {
        mintTo("alice", 1000L);

        ledgerService.burn("alice", 250L);

        assertEquals(750L, ledgerService.getBalance("alice"));
        assertEquals(750L, ledgerService.getTotalSupply());
        assertThrows(InsufficientBalanceException.class, () -> ledgerService.burn("alice", 751L));
        assertConserved();
    }

    @Test
    void testPauseHaltsMovements() {
        mintTo("alice", 1000L);
        ledgerService.setPaused(ADMIN, true);

        assertThrows(PausedException.class, () -> ledgerService.transfer("alice", "bob", 10L));
        assertThrows(PausedException.class, () -> ledgerService.burn("alice", 10L));
        AuthorizationToken token = grantMint("alice", 10L);
        assertThrows(PausedException.class, () -> ledgerService.mint("alice", 10L, token));

        ledgerService.setPaused(ADMIN, false);
        ledgerService.transfer("alice", "bob", 10L);
        assertEquals(10L, ledgerService.getBalance("bob"));
    }

    @Test
    void testFrozenSenderCannotTransferButCanReceive() {
        mintTo("alice", 1000L);
        mintTo("bob", 1000L);
        ledgerService.setFrozen(ADMIN, "alice", true);

        assertThrows(FrozenException.class, () -> ledgerService.transfer("alice", "bob", 10L));

        ledgerService.transfer("bob", "alice", 10L);
        assertEquals(1010L, ledgerService.getBalance("alice"));
    }

    @Test
    void testHoldsRequireAdmin() {
        assertThrows(UnauthorizedException.class, () -> ledgerService.setPaused("alice", true));
        assertThrows(UnauthorizedException.class, () -> ledgerService.setFrozen("alice", "bob", true));
        assertFalse(ledgerService.isPaused());
    }

    @Test
    void testCloseOutRequiresEmptyAccount() {
        mintTo("alice", 10L);

        assertThrows(InvalidStateException.class, () -> ledgerService.closeOut("alice"));

        ledgerService.closeOut("bob");
        assertThrows(RecordNotFoundException.class, () -> ledgerService.getAccount("bob"));
    }

    @Test
    void testJournalRecordsEveryMovement() {
        mintTo("alice", 1000L);
        ledgerService.transfer("alice", "bob", 300L, "Invoice 42");
        ledgerService.burn("bob", 100L);

        List<LedgerEntry> aliceEntries = ledgerService.getAccountJournal("alice");
        List<LedgerEntry> bobEntries = ledgerService.getAccountJournal("bob");

        assertEquals(2, aliceEntries.size());
        assertEquals(2, bobEntries.size());
        assertEquals(1, entryRepository.findByTransactionType(TransactionType.BURN).size());
        assertTrue(bobEntries.stream().anyMatch(e -> "Invoice 42".equals(e.getMemo())));
    }

    @Test
    void testConservationAcrossMixedSequence() {
        ledgerService.optIn("carol");
        mintTo("alice", 5000L);
        mintTo("bob", 3000L);
        ledgerService.transfer("alice", "carol", 1200L);
        ledgerService.burn("bob", 700L);
        ledgerService.transfer("carol", "bob", 200L);

        assertEquals(7300L, ledgerService.getTotalSupply());
        assertConserved();
    }
}
