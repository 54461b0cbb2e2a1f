package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.DiversifiedOperation;
import com.synthetic.solvency.domain.model.DiversifiedPositionRequest;
import com.synthetic.solvency.domain.model.DiversifiedPositionResult;
import com.synthetic.solvency.domain.model.Health;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PriceQuote;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Multi-asset deposit and mint. Spreading collateral over more assets lowers
 * the required collateral ratio by the diversification bonus.
 * {@link DiversifiedOperation#DEPOSIT_ONLY} runs every gate and returns the
 * figures, but commits nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiversifiedPositionManager {

    private final SolvencyState state;
    private final PositionLedger positionLedger;
    private final PriceOracleFeed priceOracleFeed;
    private final SolvencyProperties properties;
    private final SolvencyEventPublisher eventPublisher;

    public DiversifiedPositionResult manage(DiversifiedPositionRequest request, long now) {
        Evaluation evaluation = state.write("diversified-" + request.operation().name().toLowerCase(), () -> {
            Evaluation evaluated = evaluate(request, now);
            if (request.operation().commits()) {
                positionLedger.commit(evaluated.projected(), evaluated.newTotalCollateral(), evaluated.newTotalSupply());
                eventPublisher.positionChanged(SolvencyEventType.DIVERSIFIED_MINT,
                        evaluated.projected(), request.syntheticAmount(), now);
            }
            return evaluated;
        });

        DiversifiedPositionResult result = evaluation.result();
        if (result.committed()) {
            log.info("[Diversified] 분산 발행: account={}, assets={}, locked={}, minted={}, bonus={}, protected={}",
                    request.account(), request.assetIds(), result.collateralLocked(),
                    request.syntheticAmount(), result.diversificationBonus(),
                    evaluation.projected().isLiquidationProtected());
        } else {
            log.debug("[Diversified] 예치 시뮬레이션: account={}, assets={}, health={}, maxAdditional={}",
                    request.account(), request.assetIds(), result.healthRatio().wireValue(),
                    result.maxAdditionalMintable());
        }
        return result;
    }

    private Evaluation evaluate(DiversifiedPositionRequest request, long now) {
        int count = request.assetIds().size();
        if (count <= 1 || count > properties.getMaxDiversifiedAssets()
                || request.amounts().size() != count
                || request.riskScores().size() != count) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT,
                    "diversified positions need 2.." + properties.getMaxDiversifiedAssets()
                            + " assets with matching amounts and risk scores");
        }
        state.requireNotPaused();
        PriceQuote quote = priceOracleFeed.currentQuote();
        priceOracleFeed.requireFresh(quote, now);
        if (request.syntheticAmount() < 0) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "synthetic amount must not be negative");
        }

        long totalCollateralValue = sum(request.amounts(), "amount");
        long avgRiskScore = sum(request.riskScores(), "risk score") / count;
        long diversificationBonus = count > 2
                ? properties.getDiversificationBonusLarge()
                : properties.getDiversificationBonusSmall();
        long adjustedRatio = FixedPointMath.sub(properties.getMinCollateralRatio(), diversificationBonus);

        Position current = positionLedger.openOrGet(request.account());
        boolean minting = request.operation().commits();
        long projectedDebt = minting
                ? FixedPointMath.add(current.getSyntheticMinted(), request.syntheticAmount())
                : current.getSyntheticMinted();
        long projectedCollateral = FixedPointMath.add(current.getCollateralDeposited(), totalCollateralValue);
        long maxMintable = FixedPointMath.maxMintable(projectedCollateral, quote.price(), adjustedRatio);
        Health newHealth = FixedPointMath.positionHealth(projectedCollateral, projectedDebt, quote.price());
        long positionShare = FixedPointMath.mulDiv(projectedCollateral, FixedPointMath.PERCENT, state.getTotalCollateral());

        if (positionShare > properties.getMaxPositionPercentage()) {
            throw new SolvencyException(SolvencyErrorCode.EXCEEDS_MAX_POSITION,
                    "position share " + positionShare + "% exceeds " + properties.getMaxPositionPercentage() + "%");
        }
        if (!newHealth.isAtLeast(properties.getMinCollateralRatio())) {
            throw new SolvencyException(SolvencyErrorCode.INSUFFICIENT_COLLATERAL,
                    "projected health " + newHealth.wireValue() + " below " + properties.getMinCollateralRatio());
        }
        if (request.syntheticAmount() > maxMintable) {
            throw new SolvencyException(SolvencyErrorCode.INSUFFICIENT_COLLATERAL,
                    "synthetic amount " + request.syntheticAmount() + " exceeds max mintable " + maxMintable);
        }
        if (avgRiskScore < properties.getMinAverageRiskScore()) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT,
                    "average risk score " + avgRiskScore + " below " + properties.getMinAverageRiskScore());
        }

        long newTotalCollateral = FixedPointMath.add(state.getTotalCollateral(), totalCollateralValue);
        long newTotalSupply = minting
                ? FixedPointMath.add(state.getTotalSyntheticSupply(), request.syntheticAmount())
                : state.getTotalSyntheticSupply();
        Position projected = current.toBuilder()
                .collateralDeposited(projectedCollateral)
                .syntheticMinted(projectedDebt)
                .positionHealth(newHealth)
                .lastInteractionBlock(now)
                .liquidationProtected(diversificationBonus > properties.getProtectionBonusThreshold())
                .build();
        long maxAdditional = maxMintable > projectedDebt ? maxMintable - projectedDebt : 0L;

        DiversifiedPositionResult result = new DiversifiedPositionResult(
                newHealth, diversificationBonus, maxAdditional, avgRiskScore, totalCollateralValue, minting);
        return new Evaluation(result, projected, newTotalCollateral, newTotalSupply);
    }

    private long sum(List<Long> values, String label) {
        long total = 0;
        for (Long value : values) {
            if (value == null || value < 0) {
                throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, label + " must not be negative");
            }
            total = FixedPointMath.add(total, value);
        }
        return total;
    }

    private record Evaluation(
            DiversifiedPositionResult result,
            Position projected,
            long newTotalCollateral,
            long newTotalSupply
    ) {
    }
}
