package com.esgledger.escrow;

import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for how EscrowService drives ledger transfers.
 *
 * The ledger is mocked so each test can assert exactly which transfers
 * an escrow transition requests.
 */
@ExtendWith(MockitoExtension.class)
class EscrowResolutionTest {

    private static final String HOLDING = "escrow-holding";
    private static final String ADMIN = "admin";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private EscrowRepository escrowRepository;

    @Mock
    private EscrowBookRepository bookRepository;

    @Mock
    private LedgerService ledgerService;

    private EscrowService escrowService;

    @BeforeEach
    void setUp() {
        escrowService = new EscrowService(escrowRepository, bookRepository, ledgerService);
        ReflectionTestUtils.setField(escrowService, "holdingAccountId", HOLDING);
        ReflectionTestUtils.setField(escrowService, "defaultArbitrationFee", 1_000_000L);
    }

    private Escrow disputedEscrow(long amount) {
        Escrow escrow = new Escrow("e-1", "buyer", "seller", amount, NOW.plusSeconds(3600), null, "buyer", NOW);
        escrow.markFunded(NOW);
        escrow.markDisputed("buyer", "damaged");
        when(escrowRepository.findById("e-1")).thenReturn(Optional.of(escrow));
        when(bookRepository.findById(EscrowBook.SINGLETON_ID)).thenReturn(Optional.of(new EscrowBook(0L)));
        return escrow;
    }

    @Test
    void testSplitSendsFloorHalfToSeller() {
        disputedEscrow(999L);

        Escrow resolved = escrowService.resolveDispute(ADMIN, "e-1", DisputeResolution.SPLIT, NOW);

        verify(ledgerService).transfer(eq(HOLDING), eq("seller"), eq(499L), anyString());
        verify(ledgerService).transfer(eq(HOLDING), eq("buyer"), eq(500L), anyString());
        assertEquals(EscrowStatus.COMPLETED, resolved.getStatus());
        assertEquals(DisputeResolution.SPLIT, resolved.getResolution());
    }

    @Test
    void testSplitOfOneUnitGoesToBuyer() {
        disputedEscrow(1L);

        escrowService.resolveDispute(ADMIN, "e-1", DisputeResolution.SPLIT, NOW);

        verify(ledgerService).transfer(eq(HOLDING), eq("buyer"), eq(1L), anyString());
        verify(ledgerService, never()).transfer(eq(HOLDING), eq("seller"), anyLong(), anyString());
    }

    @Test
    void testRefundMovesWholeDepositToBuyer() {
        disputedEscrow(4_000L);

        escrowService.resolveDispute(ADMIN, "e-1", DisputeResolution.REFUND_BUYER, NOW);

        verify(ledgerService).transfer(eq(HOLDING), eq("buyer"), eq(4_000L), anyString());
        verify(ledgerService, never()).transfer(eq(HOLDING), eq("seller"), anyLong(), anyString());
    }

    @Test
    void testDisputedEscrowCannotBeReleased() {
        Escrow escrow = new Escrow("e-1", "buyer", "seller", 100L, NOW.plusSeconds(3600), null, "buyer", NOW);
        escrow.markFunded(NOW);
        escrow.markDisputed("seller", "no payment");
        when(escrowRepository.findById("e-1")).thenReturn(Optional.of(escrow));

        assertThrows(InvalidStateException.class, () -> escrowService.releaseFunds(ADMIN, "e-1", NOW));

        verify(ledgerService, never()).transfer(anyString(), anyString(), anyLong(), anyString());
        verify(escrowRepository, never()).save(any());
    }

    @Test
    void testResolveOnlyFromDisputed() {
        Escrow escrow = new Escrow("e-1", "buyer", "seller", 100L, NOW.plusSeconds(3600), null, "buyer", NOW);
        when(escrowRepository.findById("e-1")).thenReturn(Optional.of(escrow));

        assertThrows(InvalidStateException.class,
            () -> escrowService.resolveDispute(ADMIN, "e-1", DisputeResolution.PAY_SELLER, NOW));

        verify(ledgerService).requireAdmin(ADMIN, "resolve dispute");
        verify(ledgerService, never()).transfer(anyString(), anyString(), anyLong(), anyString());
    }
}
