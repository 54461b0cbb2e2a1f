package com.synthetic.solvency.api.dto;

public record LiquidationRequest(String account, Long debtToCover) {
}
