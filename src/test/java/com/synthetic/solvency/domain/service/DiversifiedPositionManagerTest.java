package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.model.DiversifiedOperation;
import com.synthetic.solvency.domain.model.DiversifiedPositionRequest;
import com.synthetic.solvency.domain.model.DiversifiedPositionResult;
import com.synthetic.solvency.domain.model.GlobalStateSnapshot;
import com.synthetic.solvency.domain.model.Health;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.synthetic.solvency.SolvencyAssertions.assertFailsWith;
import static com.synthetic.solvency.domain.service.SolvencyTestFixture.ONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DiversifiedPositionManagerTest {

    private static final List<String> THREE_ASSETS = List.of("sBTC", "sETH", "sGOLD");
    private static final List<Long> THREE_AMOUNTS = List.of(200_000L, 200_000L, 100_000L);
    private static final List<Long> THREE_SCORES = List.of(60L, 70L, 80L);

    private SolvencyTestFixture fx;

    @BeforeEach
    void setUp() {
        fx = new SolvencyTestFixture().withOracle();
        fx.price(ONE, 0);
        fx.mintingEngine.deposit("whale", 10_000_000, 0);
    }

    @Test
    void depositOnlyEvaluatesWithoutTouchingState() {
        GlobalStateSnapshot before = fx.queryService.globalState();

        DiversifiedPositionResult result = fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.DEPOSIT_ONLY, 0, THREE_SCORES), 5);

        assertThat(result.committed()).isFalse();
        assertThat(result.healthRatio()).isEqualTo(Health.UNBOUNDED);
        assertThat(result.diversificationBonus()).isEqualTo(10);
        assertThat(result.avgRiskScore()).isEqualTo(70);
        assertThat(result.collateralLocked()).isEqualTo(500_000);
        assertThat(result.maxAdditionalMintable()).isEqualTo(357_142);
        assertThat(fx.queryService.globalState()).isEqualTo(before);
        assertThat(fx.ledger.get("carol")).isEmpty();
        verify(fx.publisher, never()).positionChanged(eq(SolvencyEventType.DIVERSIFIED_MINT), any(), anyLong(), anyLong());
    }

    @Test
    void depositOnlyLeavesAnExistingPositionUntouched() {
        fx.mintingEngine.deposit("carol", 100_000, 0);
        fx.mintingEngine.mint("carol", 50_000, 10);
        Position before = fx.ledger.get("carol").orElseThrow();
        GlobalStateSnapshot stateBefore = fx.queryService.globalState();

        DiversifiedPositionResult result = fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.DEPOSIT_ONLY, 0, THREE_SCORES), 20);

        assertThat(result.committed()).isFalse();
        assertThat(result.healthRatio()).isEqualTo(Health.ratio(1_200));
        assertThat(result.maxAdditionalMintable()).isEqualTo(378_571);
        assertThat(fx.ledger.get("carol")).hasValue(before);
        assertThat(fx.queryService.globalState()).isEqualTo(stateBefore);
        verify(fx.publisher, never()).positionChanged(eq(SolvencyEventType.DIVERSIFIED_MINT), any(), anyLong(), anyLong());
    }

    @Test
    void pauseIsCheckedBeforeTheSyntheticAmount() {
        fx.adminService.pause(SolvencyTestFixture.ADMIN, 1);

        assertFailsWith(SolvencyErrorCode.CONTRACT_PAUSED, () -> fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.MINT, -1, THREE_SCORES), 5));

        fx.adminService.resume(SolvencyTestFixture.ADMIN, 2);
        assertFailsWith(SolvencyErrorCode.STALE_PRICE, () -> fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.MINT, -1, THREE_SCORES), 200));
    }

    @Test
    void mintCommitsPositionAndTotals() {
        DiversifiedPositionResult result = fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.MINT, 300_000, THREE_SCORES), 5);

        Position carol = fx.ledger.get("carol").orElseThrow();
        assertThat(result.committed()).isTrue();
        assertThat(result.healthRatio()).isEqualTo(Health.ratio(166));
        assertThat(result.maxAdditionalMintable()).isEqualTo(57_142);
        assertThat(carol.getCollateralDeposited()).isEqualTo(500_000);
        assertThat(carol.getSyntheticMinted()).isEqualTo(300_000);
        assertThat(carol.isLiquidationProtected()).isTrue();
        assertThat(fx.state.getTotalCollateral()).isEqualTo(10_500_000);
        assertThat(fx.state.getTotalSyntheticSupply()).isEqualTo(300_000);
        verify(fx.publisher).positionChanged(SolvencyEventType.DIVERSIFIED_MINT, carol, 300_000L, 5L);
    }

    @Test
    void twoAssetsEarnTheSmallBonusWithoutProtection() {
        DiversifiedPositionResult result = fx.diversifiedManager.manage(
                request(List.of("sBTC", "sETH"), List.of(300_000L, 200_000L), DiversifiedOperation.MINT,
                        300_000, List.of(60L, 70L)), 5);

        assertThat(result.diversificationBonus()).isEqualTo(5);
        assertThat(result.avgRiskScore()).isEqualTo(65);
        assertThat(result.maxAdditionalMintable()).isEqualTo(44_827);
        assertThat(fx.ledger.get("carol").orElseThrow().isLiquidationProtected()).isFalse();
    }

    @Test
    void oversizedPositionIsRejected() {
        assertFailsWith(SolvencyErrorCode.EXCEEDS_MAX_POSITION, () -> fx.diversifiedManager.manage(
                request(List.of("sBTC", "sETH"), List.of(1_000_000L, 200_000L), DiversifiedOperation.MINT,
                        0, List.of(60L, 70L)), 5));
    }

    @Test
    void projectedHealthBelowMinimumIsRejected() {
        assertFailsWith(SolvencyErrorCode.INSUFFICIENT_COLLATERAL, () -> fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.MINT, 340_000, THREE_SCORES), 5));
        assertThat(fx.ledger.get("carol")).isEmpty();
    }

    @Test
    void lowAverageRiskScoreIsRejected() {
        assertFailsWith(SolvencyErrorCode.INVALID_AMOUNT, () -> fx.diversifiedManager.manage(
                request(List.of("sBTC", "sETH"), List.of(100_000L, 100_000L), DiversifiedOperation.MINT,
                        0, List.of(40L, 50L)), 5));
    }

    @Test
    void assetCountMustBeBetweenTwoAndFive() {
        assertFailsWith(SolvencyErrorCode.INVALID_AMOUNT, () -> fx.diversifiedManager.manage(
                request(List.of("sBTC"), List.of(100_000L), DiversifiedOperation.MINT, 0, List.of(60L)), 5));
        assertFailsWith(SolvencyErrorCode.INVALID_AMOUNT, () -> fx.diversifiedManager.manage(
                request(List.of("a", "b", "c", "d", "e", "f"), List.of(1L, 1L, 1L, 1L, 1L, 1L),
                        DiversifiedOperation.MINT, 0, List.of(60L, 60L, 60L, 60L, 60L, 60L)), 5));
        assertFailsWith(SolvencyErrorCode.INVALID_AMOUNT, () -> fx.diversifiedManager.manage(
                request(List.of("sBTC", "sETH"), List.of(100_000L), DiversifiedOperation.MINT,
                        0, List.of(60L, 70L)), 5));
    }

    @Test
    void emptyProtocolHasNoShareToMeasure() {
        SolvencyTestFixture empty = new SolvencyTestFixture().withOracle();
        empty.price(ONE, 0);

        assertFailsWith(SolvencyErrorCode.ARITHMETIC_ERROR, () -> empty.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.DEPOSIT_ONLY, 0, THREE_SCORES), 5));
    }

    @Test
    void stalePriceIsRejected() {
        assertFailsWith(SolvencyErrorCode.STALE_PRICE, () -> fx.diversifiedManager.manage(
                request(THREE_ASSETS, THREE_AMOUNTS, DiversifiedOperation.DEPOSIT_ONLY, 0, THREE_SCORES), 100));
    }

    @Test
    void unknownOperationFallsBackToDepositOnly() {
        assertThat(DiversifiedOperation.from("MINT")).isEqualTo(DiversifiedOperation.MINT);
        assertThat(DiversifiedOperation.from("deposit")).isEqualTo(DiversifiedOperation.DEPOSIT_ONLY);
        assertThat(DiversifiedOperation.from(null)).isEqualTo(DiversifiedOperation.DEPOSIT_ONLY);
    }

    private static DiversifiedPositionRequest request(List<String> assets, List<Long> amounts,
                                                      DiversifiedOperation operation, long synthetic,
                                                      List<Long> scores) {
        return new DiversifiedPositionRequest("carol", assets, amounts, operation, synthetic, scores);
    }
}
