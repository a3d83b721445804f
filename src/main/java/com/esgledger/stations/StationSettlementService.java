package com.esgledger.stations;

import com.esgledger.common.Amounts;
import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.common.exception.NothingPendingException;
import com.esgledger.common.exception.PausedException;
import com.esgledger.common.exception.RecordNotFoundException;
import com.esgledger.common.exception.StationInactiveException;
import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.AuthorizationToken;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Service for charging station revenue and its settlement to operators.
 *
 * Settlement flow:
 * 1. Gross transactions are recorded; the platform fee is withheld and the net added to pending
 * 2. The operator requests a settlement, snapshotting the pending amount
 * 3. The admin approves the settlement
 * 4. The operator withdraws; the amount is minted to the operator and moved from pending to settled
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StationSettlementService {

    private static final EnumSet<SettlementStatus> OPEN_STATUSES =
        EnumSet.of(SettlementStatus.PENDING, SettlementStatus.APPROVED);

    private final StationRepository stationRepository;
    private final SettlementRepository settlementRepository;
    private final StationTransactionRepository transactionRepository;
    private final SettlementPlatformRepository platformRepository;
    private final LedgerService ledgerService;

    @Value("${esg-ledger.stations.fee-rate-bps:500}")
    private int defaultFeeRateBps;

    @Transactional
    public Station registerStation(String callerId, String stationId, String operatorId, Instant now) {
        ledgerService.requireAdmin(callerId, "register station");
        if (stationRepository.existsById(stationId)) {
            throw new InvalidStateException("Station already registered: " + stationId);
        }

        Station station = stationRepository.save(new Station(stationId, operatorId, now));
        log.info("Registered station {} operated by {}", stationId, operatorId);
        return station;
    }

    @Transactional
    public Station deactivateStation(String callerId, String stationId) {
        ledgerService.requireAdmin(callerId, "deactivate station");
        Station station = getStation(stationId);
        station.deactivate();
        stationRepository.save(station);
        log.info("Deactivated station {}", stationId);
        return station;
    }

    /**
     * Record a gross transaction at an active station.
     *
     * The fee is floor(gross * feeRateBps / 10000), never rounded up.
     *
     * @throws StationInactiveException if the station is deactivated
     */
    @Transactional
    public TransactionReceipt recordTransaction(String stationId, long grossAmount, String externalRef,
                                                Instant now) {
        Amounts.requirePositive(grossAmount, "Gross amount");

        Station station = getStation(stationId);
        if (!station.isActive()) {
            throw new StationInactiveException(stationId);
        }

        SettlementPlatform platform = loadPlatformForUpdate();
        int bps = platform.getFeeRateBps();
        long fee = Amounts.feeFor(grossAmount, bps);
        long net = grossAmount - fee;

        Amounts.add(station.getVolume(), grossAmount, "Station volume");
        Amounts.add(station.getPending(), net, "Station pending");
        Amounts.add(platform.getTotalVolume(), grossAmount, "Platform volume");

        station.recordRevenue(grossAmount, fee, net);
        platform.recordRevenue(grossAmount, fee);

        stationRepository.save(station);
        platformRepository.save(platform);
        transactionRepository.save(new StationTransaction(stationId, grossAmount, fee, net, bps, externalRef, now));

        log.info("Recorded transaction at station {}: gross={}, fee={}, net={}, pending={}",
            stationId, grossAmount, fee, net, station.getPending());

        return new TransactionReceipt(stationId, grossAmount, fee, net);
    }

    /**
     * Request settlement of everything currently pending.
     *
     * A station can have only one open settlement at a time.
     *
     * @throws UnauthorizedException if the caller is not the station operator
     * @throws NothingPendingException if nothing is owed
     */
    @Transactional
    public Settlement requestSettlement(String callerId, String stationId, String settlementId,
                                        String period, Instant now) {
        Station station = getStation(stationId);
        if (!station.getOperatorId().equals(callerId)) {
            throw new UnauthorizedException(callerId, "request settlement for station " + stationId);
        }
        if (settlementRepository.existsById(settlementId)) {
            throw new InvalidStateException("Settlement already exists: " + settlementId);
        }
        if (settlementRepository.existsByStationIdAndStatusIn(stationId, OPEN_STATUSES)) {
            throw new InvalidStateException("Station " + stationId + " already has an open settlement");
        }
        if (station.getPending() == 0) {
            throw new NothingPendingException(stationId);
        }

        long amount = station.getPending();
        long feeAmount = Amounts.withheldFeeOn(amount, loadPlatform().getFeeRateBps());

        Settlement settlement = settlementRepository.save(
            new Settlement(settlementId, stationId, amount, feeAmount, period, now));

        log.info("Settlement {} requested for station {}: amount={}, withheld fee={}",
            settlementId, stationId, amount, feeAmount);

        return settlement;
    }

    @Transactional
    public Settlement approveSettlement(String callerId, String settlementId, Instant now) {
        ledgerService.requireAdmin(callerId, "approve settlement");
        Settlement settlement = getSettlement(settlementId);

        settlement.approve(callerId, now);
        settlementRepository.save(settlement);

        log.info("Settlement {} approved by {}", settlementId, callerId);
        return settlement;
    }

    /**
     * Pay an approved settlement out to the station operator.
     *
     * @throws UnauthorizedException if the caller is not the station operator
     * @throws InvalidStateException if the settlement is not approved
     */
    @Transactional
    public Settlement withdraw(String callerId, String settlementId, Instant now) {
        Settlement settlement = getSettlement(settlementId);
        Station station = getStation(settlement.getStationId());

        if (!station.getOperatorId().equals(callerId)) {
            throw new UnauthorizedException(callerId, "withdraw settlement " + settlementId);
        }
        if (settlement.getStatus() != SettlementStatus.APPROVED) {
            throw new InvalidStateException("Settlement", settlementId, settlement.getStatus().name(), "withdraw");
        }
        if (ledgerService.isPaused()) {
            throw new PausedException("withdraw");
        }
        long amount = settlement.getAmount();
        ledgerService.requireMintable(station.getOperatorId(), amount);

        station.paySettlement(amount);
        settlement.complete(now);
        stationRepository.save(station);
        settlementRepository.save(settlement);

        AuthorizationToken grant = ledgerService.issueGrant(
            GrantIssuer.STATION_SETTLEMENT, GrantAction.MINT, station.getOperatorId(), amount, settlementId);
        ledgerService.mint(station.getOperatorId(), amount, grant);

        log.info("Settlement {} paid {} to operator {} of station {}",
            settlementId, amount, station.getOperatorId(), station.getStationId());

        return settlement;
    }

    @Transactional
    public void setFeeRateBps(String callerId, int feeRateBps) {
        ledgerService.requireAdmin(callerId, "set fee rate");
        Amounts.requireFeeRate(feeRateBps);
        SettlementPlatform platform = loadPlatformForUpdate();
        platform.changeFeeRate(feeRateBps);
        platformRepository.save(platform);
        log.info("Platform fee rate set to {} bps", feeRateBps);
    }

    @Transactional(readOnly = true)
    public Station getStation(String stationId) {
        return stationRepository.findById(stationId)
            .orElseThrow(() -> new RecordNotFoundException("Station", stationId));
    }

    @Transactional(readOnly = true)
    public Settlement getSettlement(String settlementId) {
        return settlementRepository.findById(settlementId)
            .orElseThrow(() -> new RecordNotFoundException("Settlement", settlementId));
    }

    @Transactional(readOnly = true)
    public List<Station> getStationsByOperator(String operatorId) {
        return stationRepository.findByOperatorId(operatorId);
    }

    @Transactional(readOnly = true)
    public List<Settlement> getSettlements(String stationId) {
        return settlementRepository.findByStationIdOrderByRequestedAtDesc(stationId);
    }

    @Transactional(readOnly = true)
    public List<StationTransaction> getTransactions(String stationId) {
        return transactionRepository.findByStationIdOrderByRecordedAtDesc(stationId);
    }

    @Transactional(readOnly = true)
    public SettlementPlatform getPlatform() {
        return loadPlatform();
    }

    private SettlementPlatform loadPlatform() {
        return platformRepository.findById(SettlementPlatform.SINGLETON_ID)
            .orElseGet(() -> new SettlementPlatform(defaultFeeRateBps));
    }

    private SettlementPlatform loadPlatformForUpdate() {
        return platformRepository.findById(SettlementPlatform.SINGLETON_ID)
            .orElseGet(() -> platformRepository.save(new SettlementPlatform(defaultFeeRateBps)));
    }
}
