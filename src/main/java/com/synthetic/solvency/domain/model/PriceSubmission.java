package com.synthetic.solvency.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceSubmission(
        String assetId,
        long submissionId,
        String oracle,
        long price,
        long confidence,
        long timestamp
) {
}
