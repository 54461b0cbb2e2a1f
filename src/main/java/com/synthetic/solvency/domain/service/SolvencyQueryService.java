package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.model.GlobalStateSnapshot;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Read-only views taken under a single read lock, so every figure in a
 * snapshot belongs to the same committed state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SolvencyQueryService {

    private final SolvencyState state;
    private final PositionLedger positionLedger;
    private final PriceOracleFeed priceOracleFeed;
    private final LiquidationEngine liquidationEngine;

    public GlobalStateSnapshot globalState() {
        return state.read(() -> {
            PriceQuote quote = priceOracleFeed.currentQuote();
            return new GlobalStateSnapshot(
                    state.getTotalCollateral(),
                    state.getTotalSyntheticSupply(),
                    quote.price(),
                    quote.lastUpdate(),
                    state.isPaused(),
                    priceOracleFeed.getSubmissionNonce(),
                    liquidationEngine.getLiquidationNonce());
        });
    }

    public Reconciliation reconcile() {
        return state.read(() -> {
            Collection<Position> positions = positionLedger.all();
            long collateralSum = 0;
            long debtSum = 0;
            for (Position position : positions) {
                collateralSum = FixedPointMath.add(collateralSum, position.getCollateralDeposited());
                debtSum = FixedPointMath.add(debtSum, position.getSyntheticMinted());
            }
            return new Reconciliation(
                    positions.size(),
                    state.getTotalCollateral(), collateralSum,
                    state.getTotalSyntheticSupply(), debtSum);
        });
    }

    public StateReport stateReport() {
        return state.read(() -> new StateReport(globalState(), reconcile()));
    }

    @Scheduled(fixedDelayString = "${solvency.reconciliation-interval-ms:300000}")
    public void logReconciliation() {
        Reconciliation result = reconcile();
        if (result.supplyDrift() != 0) {
            log.error("[Reconcile] 합성자산 총량 불일치: total={}, sum={}, positions={}",
                    result.totalSyntheticSupply(), result.syntheticSum(), result.positionCount());
        }
        if (result.collateralDrift() != 0) {
            // liquidations seize collateral from positions without reducing the global total
            log.warn("[Reconcile] 담보 총량 드리프트: total={}, sum={}, drift={}, positions={}",
                    result.totalCollateral(), result.collateralSum(), result.collateralDrift(),
                    result.positionCount());
        } else {
            log.info("[Reconcile] 정합성 확인 완료: positions={}, collateral={}, supply={}",
                    result.positionCount(), result.totalCollateral(), result.totalSyntheticSupply());
        }
    }

    public record StateReport(GlobalStateSnapshot state, Reconciliation reconciliation) {
    }

    public record Reconciliation(
            int positionCount,
            long totalCollateral,
            long collateralSum,
            long totalSyntheticSupply,
            long syntheticSum
    ) {

        public long collateralDrift() {
            return totalCollateral - collateralSum;
        }

        public long supplyDrift() {
            return totalSyntheticSupply - syntheticSum;
        }
    }
}
