package com.synthetic.solvency.domain.model;

import java.util.List;

public record DiversifiedPositionRequest(
        String account,
        List<String> assetIds,
        List<Long> amounts,
        DiversifiedOperation operation,
        long syntheticAmount,
        List<Long> riskScores
) {

    public DiversifiedPositionRequest {
        assetIds = assetIds == null ? List.of() : List.copyOf(assetIds);
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
        riskScores = riskScores == null ? List.of() : List.copyOf(riskScores);
        operation = operation == null ? DiversifiedOperation.DEPOSIT_ONLY : operation;
    }
}
