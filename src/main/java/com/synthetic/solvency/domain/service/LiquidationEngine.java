package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Health;
import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceQuote;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import com.synthetic.solvency.domain.port.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partial liquidation of unhealthy positions. The liquidator is paid
 * {@code collateralValue * (100 + bonus) / 100} out of custody; the position
 * loses {@code collateralValue + penalty}. Total collateral is left as is, so
 * it drifts above the sum of positions by the seized amount on every
 * liquidation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidationEngine {

    private final SolvencyState state;
    private final PositionLedger positionLedger;
    private final PriceOracleFeed priceOracleFeed;
    private final TransferGateway transferGateway;
    private final SolvencyProperties properties;
    private final SolvencyEventPublisher eventPublisher;

    private final Map<Long, LiquidationRecord> history = new HashMap<>();
    private long liquidationNonce;

    public long liquidate(String liquidator, String account, long debtToCover, long now) {
        Outcome outcome = state.write("liquidate", () -> execute(liquidator, account, debtToCover, now));

        LiquidationRecord record = outcome.record();
        log.info("[Liquidation] 청산 실행: id={}, account={}, liquidator={}, debt={}, seized={}, penalty={}, reward={}, health={}",
                record.getLiquidationId(), account, liquidator, debtToCover,
                record.getCollateralSeized(), record.getPenalty(), record.getReward(),
                outcome.position().getPositionHealth().wireValue());
        return record.getLiquidationId();
    }

    public boolean isLiquidatable(String account) {
        return state.read(() -> positionLedger.get(account)
                .map(position -> liveHealth(position, priceOracleFeed.currentQuote())
                        .isBelow(properties.getLiquidationThreshold()))
                .orElse(false));
    }

    public Optional<LiquidationRecord> find(long liquidationId) {
        return state.read(() -> Optional.ofNullable(history.get(liquidationId)));
    }

    public List<LiquidationRecord> history(String account) {
        return state.read(() -> history.values().stream()
                .filter(r -> account == null || account.equals(r.getAccount()))
                .sorted((a, b) -> Long.compare(a.getLiquidationId(), b.getLiquidationId()))
                .toList());
    }

    public long getLiquidationNonce() {
        return state.read(() -> liquidationNonce);
    }

    private Outcome execute(String liquidator, String account, long debtToCover, long now) {
        state.requireNotPaused();
        Position position = positionLedger.get(account)
                .orElseThrow(() -> new SolvencyException(SolvencyErrorCode.POSITION_NOT_FOUND,
                        "no position for " + account));
        PriceQuote quote = priceOracleFeed.currentQuote();

        Health health = liveHealth(position, quote);
        if (!health.isBelow(properties.getLiquidationThreshold())) {
            throw new SolvencyException(SolvencyErrorCode.LIQUIDATION_NOT_ALLOWED,
                    "position health " + health.wireValue() + " is not below " + properties.getLiquidationThreshold());
        }
        priceOracleFeed.requireFresh(quote, now);
        long maxCoverable = position.getSyntheticMinted() / 2;
        if (debtToCover <= 0 || debtToCover > maxCoverable) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT,
                    "debt to cover " + debtToCover + " must be within (0, " + maxCoverable + "]");
        }

        long collateralValue = FixedPointMath.collateralValue(debtToCover, quote.price());
        long reward = FixedPointMath.percentOf(collateralValue, 100 + properties.getLiquidationBonus());
        long penalty = FixedPointMath.percentOf(collateralValue, properties.getLiquidationPenalty());

        long newCollateral = FixedPointMath.sub(position.getCollateralDeposited(),
                FixedPointMath.add(collateralValue, penalty));
        long newDebt = FixedPointMath.sub(position.getSyntheticMinted(), debtToCover);
        long newSupply = FixedPointMath.sub(state.getTotalSyntheticSupply(), debtToCover);
        long liquidationId = FixedPointMath.add(liquidationNonce, 1);

        Position updated = position.toBuilder()
                .collateralDeposited(newCollateral)
                .syntheticMinted(newDebt)
                .positionHealth(FixedPointMath.positionHealth(newCollateral, newDebt, quote.price()))
                .lastInteractionBlock(now)
                .build();
        LiquidationRecord record = LiquidationRecord.builder()
                .liquidationId(liquidationId)
                .account(account)
                .liquidator(liquidator)
                .collateralSeized(collateralValue)
                .penalty(penalty)
                .debtCovered(debtToCover)
                .reward(reward)
                .blockHeight(now)
                .build();

        payReward(liquidator, reward);

        positionLedger.commit(updated, state.getTotalCollateral(), newSupply);
        history.put(liquidationId, record);
        liquidationNonce = liquidationId;
        eventPublisher.liquidated(record, updated);
        return new Outcome(record, updated);
    }

    private void payReward(String liquidator, long reward) {
        String custody = transferGateway.custodyIdentity();
        boolean moved;
        try {
            moved = transferGateway.transfer(reward, custody, liquidator);
        } catch (RuntimeException e) {
            throw new SolvencyException(SolvencyErrorCode.TRANSFER_FAILED,
                    "reward transfer to " + liquidator + " failed", e);
        }
        if (!moved) {
            throw new SolvencyException(SolvencyErrorCode.TRANSFER_FAILED,
                    "ledger refused reward transfer of " + reward + " to " + liquidator);
        }
    }

    private Health liveHealth(Position position, PriceQuote quote) {
        return FixedPointMath.positionHealth(
                position.getCollateralDeposited(), position.getSyntheticMinted(), quote.price());
    }

    private record Outcome(LiquidationRecord record, Position position) {
    }
}
