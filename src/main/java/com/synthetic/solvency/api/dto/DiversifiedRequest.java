package com.synthetic.solvency.api.dto;

import java.util.List;

public record DiversifiedRequest(
        List<String> assetIds,
        List<Long> amounts,
        String operation,
        Long syntheticAmount,
        List<Long> riskScores
) {
}
