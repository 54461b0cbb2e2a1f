package com.synthetic.solvency.domain.model;

public record GlobalStateSnapshot(
        long totalCollateral,
        long totalSyntheticSupply,
        long currentPrice,
        long lastPriceUpdate,
        boolean paused,
        long submissionNonce,
        long liquidationNonce
) {
}
