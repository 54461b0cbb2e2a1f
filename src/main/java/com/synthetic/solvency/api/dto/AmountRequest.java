package com.synthetic.solvency.api.dto;

public record AmountRequest(Long amount) {
}
