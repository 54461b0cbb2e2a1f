package com.synthetic.solvency.api.dto;

public record PriceSubmissionRequest(String assetId, Long price, Long confidence) {
}
