package com.synthetic.solvency.domain.model;

public record DiversifiedPositionResult(
        Health healthRatio,
        long diversificationBonus,
        long maxAdditionalMintable,
        long avgRiskScore,
        long collateralLocked,
        boolean committed
) {
}
