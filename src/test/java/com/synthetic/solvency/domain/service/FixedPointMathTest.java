package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.model.Health;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

import static com.synthetic.solvency.SolvencyAssertions.assertFailsWith;
import static org.assertj.core.api.Assertions.assertThat;

class FixedPointMathTest {

    private static final long ONE = FixedPointMath.PRICE_SCALE;

    @Test
    void healthWithoutDebtIsUnbounded() {
        assertThat(FixedPointMath.positionHealth(0, 0, ONE)).isEqualTo(Health.UNBOUNDED);
        assertThat(FixedPointMath.positionHealth(Long.MAX_VALUE, 0, Long.MAX_VALUE).isUnbounded()).isTrue();
        assertThat(FixedPointMath.positionHealth(200, 0, ONE).wireValue()).isEqualTo(999_999L);
    }

    @Test
    void healthTruncatesTowardZero() {
        assertThat(FixedPointMath.positionHealth(200, 133, ONE)).isEqualTo(Health.ratio(150));
        assertThat(FixedPointMath.positionHealth(200, 133, 70_000_000L)).isEqualTo(Health.ratio(105));
        assertThat(FixedPointMath.positionHealth(200, 100, 2 * ONE)).isEqualTo(Health.ratio(400));
    }

    @Test
    void healthSurvivesProductsWiderThanLong() {
        Health health = FixedPointMath.positionHealth(Long.MAX_VALUE / 2, Long.MAX_VALUE / 4, ONE);

        assertThat(health).isEqualTo(Health.ratio(200));
    }

    @Test
    void maxMintableAtMinimumRatio() {
        assertThat(FixedPointMath.maxMintable(200, ONE, 150)).isEqualTo(133);
        assertThat(FixedPointMath.maxMintable(500_000, ONE, 140)).isEqualTo(357_142);
        assertThat(FixedPointMath.maxMintable(0, ONE, 150)).isZero();
    }

    @Test
    void feesAndPercentagesTruncate() {
        assertThat(FixedPointMath.bpsOf(100, 50)).isZero();
        assertThat(FixedPointMath.bpsOf(10_000, 50)).isEqualTo(50);
        assertThat(FixedPointMath.percentOf(85, 110)).isEqualTo(93);
        assertThat(FixedPointMath.percentOf(85, 5)).isEqualTo(4);
        assertThat(FixedPointMath.collateralValue(60, 70_000_000L)).isEqualTo(85);
    }

    @Test
    void freshnessIsStrictlyBelowTheLimit() {
        assertThat(FixedPointMath.isFresh(20, 119, 100)).isTrue();
        assertThat(FixedPointMath.isFresh(20, 120, 100)).isFalse();
    }

    @Test
    void overflowUnderflowAndDivisionByZeroAreArithmeticErrors() {
        assertArithmeticError(() -> FixedPointMath.add(Long.MAX_VALUE, 1));
        assertArithmeticError(() -> FixedPointMath.sub(1, 2));
        assertArithmeticError(() -> FixedPointMath.mulDiv(Long.MAX_VALUE, 2, 1));
        assertArithmeticError(() -> FixedPointMath.mulDiv(1, 1, 0));
        assertArithmeticError(() -> FixedPointMath.collateralValue(10, 0));
        assertArithmeticError(() -> FixedPointMath.add(-1, 1));
    }

    private static void assertArithmeticError(ThrowingCallable call) {
        assertFailsWith(SolvencyErrorCode.ARITHMETIC_ERROR, call);
    }
}
