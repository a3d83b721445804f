package com.esgledger.governance;

import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for matching governance grants against executed proposals.
 */
@ExtendWith(MockitoExtension.class)
class ProposalGrantSourceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ProposalRepository proposalRepository;

    private ProposalGrantSource source;

    @BeforeEach
    void setUp() {
        source = new ProposalGrantSource(proposalRepository, new ProposalPayloads(new ObjectMapper()));
    }

    private Proposal proposal(String id, ProposalType type, String payload, boolean executed) {
        Proposal proposal = new Proposal(id, "member-1", type, payload, NOW, NOW.plusSeconds(3600));
        if (executed) {
            proposal.markExecuted("member-1", NOW);
        }
        when(proposalRepository.findById(id)).thenReturn(Optional.of(proposal));
        return proposal;
    }

    @Test
    void testVouchesForGovernance() {
        assertEquals(GrantIssuer.GOVERNANCE, source.getIssuer());
    }

    @Test
    void testExecutedMintProposalBacksExactGrant() {
        proposal("p-1", ProposalType.MINT, "{\"recipient\":\"farmer-1\",\"amount\":5000}", true);

        assertDoesNotThrow(() -> source.verify(GrantAction.MINT, "farmer-1", 5000L, "p-1"));
        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.MINT, "farmer-2", 5000L, "p-1"));
        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.MINT, "farmer-1", 5001L, "p-1"));
        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.PAUSE, null, 0L, "p-1"));
    }

    @Test
    void testUnexecutedProposalBacksNothing() {
        proposal("p-2", ProposalType.PAUSE, null, false);

        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.PAUSE, null, 0L, "p-2"));
    }

    @Test
    void testUnknownProposalBacksNothing() {
        when(proposalRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.MINT, "farmer-1", 1L, "ghost"));
    }

    @Test
    void testFreezeGrantMustNameProposedAccount() {
        proposal("p-3", ProposalType.FREEZE, "{\"account\":\"mallory\"}", true);

        assertDoesNotThrow(() -> source.verify(GrantAction.FREEZE, "mallory", 0L, "p-3"));
        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.FREEZE, "alice", 0L, "p-3"));
        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.UNFREEZE, "mallory", 0L, "p-3"));
    }

    @Test
    void testTextProposalAuthorizesNoGrant() {
        proposal("p-4", ProposalType.TEXT, "quarterly report", true);

        assertThrows(UnauthorizedException.class, () -> source.verify(GrantAction.PAUSE, null, 0L, "p-4"));
    }
}
