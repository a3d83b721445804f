package com.esgledger.escrow;

import com.esgledger.common.Amounts;
import com.esgledger.common.exception.InvalidAmountException;
import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.common.exception.RecordNotFoundException;
import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Service for buyer/seller escrows backed by ledger transfers.
 *
 * Escrow flow:
 * 1. An escrow is created for a fixed amount and deadline
 * 2. The buyer deposits the amount into the escrow holding account
 * 3. The seller confirms shipment, the buyer confirms receipt
 * 4. Funds are released to the seller once both confirmed, by the admin, or after the deadline
 *
 * Either party may raise a dispute before completion; only the admin can
 * then resolve it. Cancellation refunds whatever was deposited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final EscrowRepository escrowRepository;
    private final EscrowBookRepository bookRepository;
    private final LedgerService ledgerService;

    @Value("${esg-ledger.escrow.holding-account:escrow-holding}")
    private String holdingAccountId;

    @Value("${esg-ledger.escrow.arbitration-fee:1000000}")
    private long defaultArbitrationFee;

    @Transactional
    public Escrow createEscrow(String callerId, String escrowId, String buyerId, String sellerId, long amount,
                               String contractHash, Instant deadline, Instant now) {
        Amounts.requirePositive(amount, "Escrow amount");
        if (buyerId.equals(sellerId)) {
            throw new InvalidAmountException("Buyer and seller must differ: " + buyerId);
        }
        ledgerService.requireNotReserved(buyerId, "buy through escrow");
        ledgerService.requireNotReserved(sellerId, "sell through escrow");
        if (!deadline.isAfter(now)) {
            throw new InvalidAmountException("Escrow deadline must be in the future: " + deadline);
        }
        if (escrowRepository.existsById(escrowId)) {
            throw new InvalidStateException("Escrow already exists: " + escrowId);
        }

        Escrow escrow = escrowRepository.save(
            new Escrow(escrowId, buyerId, sellerId, amount, deadline, contractHash, callerId, now));

        log.info("Created escrow {} buyer={} seller={} amount={} deadline={}",
            escrowId, buyerId, sellerId, amount, deadline);

        return escrow;
    }

    /**
     * Move the escrow amount from the buyer into the holding account.
     *
     * @throws UnauthorizedException if the caller is not the buyer
     * @throws InvalidStateException if the escrow is not awaiting a deposit
     */
    @Transactional
    public Escrow depositFunds(String callerId, String escrowId, Instant now) {
        Escrow escrow = getEscrow(escrowId);
        if (!escrow.getBuyerId().equals(callerId)) {
            throw new UnauthorizedException(callerId, "deposit into escrow " + escrowId);
        }
        requireStatus(escrow, EscrowStatus.CREATED, "deposit");

        ledgerService.ensureOptedIn(holdingAccountId);
        ledgerService.transfer(escrow.getBuyerId(), holdingAccountId, escrow.getAmount(),
            "Escrow deposit " + escrowId);

        escrow.markFunded(now);
        escrowRepository.save(escrow);

        EscrowBook book = loadBookForUpdate();
        book.recordDeposit(escrow.getAmount());
        bookRepository.save(book);

        log.info("Escrow {} funded with {}", escrowId, escrow.getAmount());
        return escrow;
    }

    @Transactional
    public Escrow confirmShipment(String callerId, String escrowId, String shipmentRef) {
        Escrow escrow = getEscrow(escrowId);
        if (!escrow.getSellerId().equals(callerId)) {
            throw new UnauthorizedException(callerId, "confirm shipment for escrow " + escrowId);
        }
        requireStatus(escrow, EscrowStatus.FUNDED, "confirm shipment");

        escrow.markShipped(shipmentRef);
        escrowRepository.save(escrow);

        log.info("Escrow {} shipped (ref={})", escrowId, shipmentRef);
        return escrow;
    }

    @Transactional
    public Escrow confirmReceipt(String callerId, String escrowId, String receiptRef) {
        Escrow escrow = getEscrow(escrowId);
        if (!escrow.getBuyerId().equals(callerId)) {
            throw new UnauthorizedException(callerId, "confirm receipt for escrow " + escrowId);
        }
        requireStatus(escrow, EscrowStatus.SHIPPED, "confirm receipt");

        escrow.markReceived(receiptRef);
        escrowRepository.save(escrow);

        log.info("Escrow {} receipt confirmed (ref={})", escrowId, receiptRef);
        return escrow;
    }

    /**
     * Pay the deposit to the seller.
     *
     * Allowed once both parties confirmed, for the admin at any time, or
     * for anyone once the deadline has passed. A disputed escrow can only
     * be settled through {@link #resolveDispute}.
     *
     * @throws InvalidStateException if the escrow is not funded, or already settled
     * @throws UnauthorizedException if none of the release conditions hold
     */
    @Transactional
    public Escrow releaseFunds(String callerId, String escrowId, Instant now) {
        Escrow escrow = getEscrow(escrowId);
        EscrowStatus status = escrow.getStatus();
        if ((status != EscrowStatus.FUNDED && status != EscrowStatus.SHIPPED) || escrow.getDepositAmount() == 0) {
            throw new InvalidStateException("Escrow", escrowId, status.name(), "release");
        }

        boolean permitted = escrow.isConfirmedByBoth()
            || ledgerService.isAdmin(callerId)
            || escrow.isPastDeadline(now);
        if (!permitted) {
            throw new UnauthorizedException(callerId, "release escrow " + escrowId);
        }

        long deposit = escrow.getDepositAmount();
        ledgerService.transfer(holdingAccountId, escrow.getSellerId(), deposit, "Escrow release " + escrowId);

        escrow.markCompleted(now);
        escrowRepository.save(escrow);

        EscrowBook book = loadBookForUpdate();
        book.recordPayout(deposit, 0L);
        bookRepository.save(book);

        log.info("Escrow {} released {} to seller {}", escrowId, deposit, escrow.getSellerId());
        return escrow;
    }

    /**
     * Flag the escrow as disputed. Raising again replaces the reason.
     */
    @Transactional
    public Escrow raiseDispute(String callerId, String escrowId, String reason) {
        Escrow escrow = getEscrow(escrowId);
        if (!escrow.isParty(callerId)) {
            throw new UnauthorizedException(callerId, "dispute escrow " + escrowId);
        }
        if (escrow.getStatus().isTerminal()) {
            throw new InvalidStateException("Escrow", escrowId, escrow.getStatus().name(), "dispute");
        }

        escrow.markDisputed(callerId, reason);
        escrowRepository.save(escrow);

        log.warn("Escrow {} disputed by {}: {}", escrowId, callerId, reason);
        return escrow;
    }

    /**
     * Settle a disputed escrow. Only the deposit is ever moved.
     */
    @Transactional
    public Escrow resolveDispute(String callerId, String escrowId, DisputeResolution resolution, Instant now) {
        ledgerService.requireAdmin(callerId, "resolve dispute");
        Escrow escrow = getEscrow(escrowId);
        requireStatus(escrow, EscrowStatus.DISPUTED, "resolve");

        long deposit = escrow.getDepositAmount();
        long toSeller = switch (resolution) {
            case REFUND_BUYER -> 0L;
            case PAY_SELLER -> deposit;
            case SPLIT -> deposit / 2;
        };
        long toBuyer = deposit - toSeller;

        if (toSeller > 0) {
            ledgerService.transfer(holdingAccountId, escrow.getSellerId(), toSeller,
                "Escrow resolution " + escrowId);
        }
        if (toBuyer > 0) {
            ledgerService.transfer(holdingAccountId, escrow.getBuyerId(), toBuyer,
                "Escrow resolution " + escrowId);
        }

        escrow.markResolved(resolution, now);
        escrowRepository.save(escrow);

        if (deposit > 0) {
            EscrowBook book = loadBookForUpdate();
            book.recordPayout(toSeller, toBuyer);
            bookRepository.save(book);
        }

        log.info("Escrow {} resolved {}: seller={}, buyer={}", escrowId, resolution, toSeller, toBuyer);
        return escrow;
    }

    /**
     * Cancel the escrow and refund any deposit to the buyer.
     *
     * @throws UnauthorizedException unless the caller is the admin, or a party once both confirmed
     */
    @Transactional
    public Escrow cancelEscrow(String callerId, String escrowId, Instant now) {
        Escrow escrow = getEscrow(escrowId);
        if (escrow.getStatus().isTerminal()) {
            throw new InvalidStateException("Escrow", escrowId, escrow.getStatus().name(), "cancel");
        }
        boolean partyMayCancel = escrow.isParty(callerId) && escrow.isConfirmedByBoth();
        if (!ledgerService.isAdmin(callerId) && !partyMayCancel) {
            throw new UnauthorizedException(callerId, "cancel escrow " + escrowId);
        }

        long deposit = escrow.getDepositAmount();
        if (deposit > 0) {
            ledgerService.transfer(holdingAccountId, escrow.getBuyerId(), deposit, "Escrow refund " + escrowId);
            EscrowBook book = loadBookForUpdate();
            book.recordPayout(0L, deposit);
            bookRepository.save(book);
        }

        escrow.markCancelled(now);
        escrowRepository.save(escrow);

        log.info("Escrow {} cancelled, refunded {} to {}", escrowId, deposit, escrow.getBuyerId());
        return escrow;
    }

    @Transactional
    public void setArbitrationFee(String callerId, long arbitrationFee) {
        ledgerService.requireAdmin(callerId, "set arbitration fee");
        Amounts.requireNonNegative(arbitrationFee, "Arbitration fee");
        EscrowBook book = loadBookForUpdate();
        book.changeArbitrationFee(arbitrationFee);
        bookRepository.save(book);
        log.info("Arbitration fee set to {}", arbitrationFee);
    }

    @Transactional(readOnly = true)
    public Escrow getEscrow(String escrowId) {
        return escrowRepository.findById(escrowId)
            .orElseThrow(() -> new RecordNotFoundException("Escrow", escrowId));
    }

    @Transactional(readOnly = true)
    public List<Escrow> getEscrowsFor(String accountId) {
        return escrowRepository.findByBuyerIdOrSellerIdOrderByCreatedAtDesc(accountId, accountId);
    }

    @Transactional(readOnly = true)
    public EscrowBook getBook() {
        return loadBook();
    }

    public String getHoldingAccountId() {
        return holdingAccountId;
    }

    private void requireStatus(Escrow escrow, EscrowStatus expected, String operation) {
        if (escrow.getStatus() != expected) {
            throw new InvalidStateException("Escrow", escrow.getEscrowId(), escrow.getStatus().name(), operation);
        }
    }

    private EscrowBook loadBook() {
        return bookRepository.findById(EscrowBook.SINGLETON_ID)
            .orElseGet(() -> new EscrowBook(defaultArbitrationFee));
    }

    private EscrowBook loadBookForUpdate() {
        return bookRepository.findById(EscrowBook.SINGLETON_ID)
            .orElseGet(() -> bookRepository.save(new EscrowBook(defaultArbitrationFee)));
    }
}
