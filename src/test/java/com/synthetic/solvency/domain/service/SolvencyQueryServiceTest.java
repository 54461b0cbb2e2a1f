package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.model.GlobalStateSnapshot;
import org.junit.jupiter.api.Test;

import static com.synthetic.solvency.domain.service.SolvencyTestFixture.ONE;
import static org.assertj.core.api.Assertions.assertThat;

class SolvencyQueryServiceTest {

    @Test
    void globalStateReflectsCommittedTotals() {
        SolvencyTestFixture fx = new SolvencyTestFixture().withOracle();
        fx.price(ONE, 0);
        fx.mintingEngine.deposit("alice", 200, 0);
        fx.mintingEngine.mint("alice", 100, 10);

        GlobalStateSnapshot snapshot = fx.queryService.globalState();

        assertThat(snapshot).isEqualTo(new GlobalStateSnapshot(200, 100, ONE, 0, false, 1, 0));
    }

    @Test
    void stateReportPairsTotalsWithTheirReconciliation() {
        SolvencyTestFixture fx = new SolvencyTestFixture().withOracle();
        fx.price(ONE, 0);
        fx.mintingEngine.deposit("alice", 200, 0);
        fx.mintingEngine.mint("alice", 133, 10);
        fx.price(70_000_000L, 20);
        fx.liquidationEngine.liquidate("bob", "alice", 60, 25);

        SolvencyQueryService.StateReport report = fx.queryService.stateReport();

        assertThat(report.state()).isEqualTo(fx.queryService.globalState());
        assertThat(report.reconciliation().totalCollateral()).isEqualTo(report.state().totalCollateral());
        assertThat(report.reconciliation().totalSyntheticSupply()).isEqualTo(report.state().totalSyntheticSupply());
        assertThat(report.reconciliation().collateralDrift()).isEqualTo(89);
        assertThat(report.state().liquidationNonce()).isEqualTo(1);
    }

    @Test
    void reconciliationIsCleanWithoutLiquidations() {
        SolvencyTestFixture fx = new SolvencyTestFixture().withOracle();
        fx.price(ONE, 0);
        fx.mintingEngine.deposit("alice", 200, 0);
        fx.mintingEngine.deposit("bob", 300, 0);
        fx.mintingEngine.mint("bob", 150, 10);

        SolvencyQueryService.Reconciliation reconciliation = fx.queryService.reconcile();

        assertThat(reconciliation.positionCount()).isEqualTo(2);
        assertThat(reconciliation.collateralSum()).isEqualTo(500);
        assertThat(reconciliation.syntheticSum()).isEqualTo(150);
        assertThat(reconciliation.collateralDrift()).isZero();
        assertThat(reconciliation.supplyDrift()).isZero();
        fx.queryService.logReconciliation();
    }
}
