package com.synthetic.solvency.domain.model;

public record PositionSnapshot(
        String account,
        long collateralDeposited,
        long syntheticMinted,
        long lastInteractionBlock,
        long positionHealth,
        boolean healthUnbounded,
        boolean liquidationProtected
) {

    public static PositionSnapshot from(Position position) {
        Health health = position.getPositionHealth();
        return new PositionSnapshot(
                position.getAccount(),
                position.getCollateralDeposited(),
                position.getSyntheticMinted(),
                position.getLastInteractionBlock(),
                health.wireValue(),
                health.isUnbounded(),
                position.isLiquidationProtected());
    }
}
