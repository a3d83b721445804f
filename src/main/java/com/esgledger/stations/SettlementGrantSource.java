package com.esgledger.stations;

import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.GrantSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Backs settlement payouts with a completed settlement of the operator's station.
 */
@Component
@RequiredArgsConstructor
public class SettlementGrantSource implements GrantSource {

    private final SettlementRepository settlementRepository;
    private final StationRepository stationRepository;

    @Override
    public GrantIssuer getIssuer() {
        return GrantIssuer.STATION_SETTLEMENT;
    }

    @Override
    public void verify(GrantAction action, String targetAccountId, long amount, String settlementId) {
        Settlement settlement = settlementRepository.findById(settlementId)
            .filter(s -> s.getStatus() == SettlementStatus.COMPLETED)
            .orElseThrow(() -> new UnauthorizedException("No completed settlement backs grant source " + settlementId));

        String operatorId = stationRepository.findById(settlement.getStationId())
            .map(Station::getOperatorId)
            .orElse(null);
        if (operatorId == null || !operatorId.equals(targetAccountId) || settlement.getAmount() != amount) {
            throw new UnauthorizedException(String.format(
                "Settlement %s pays %d to %s, not %d to %s",
                settlementId, settlement.getAmount(), operatorId, amount, targetAccountId));
        }
    }
}
