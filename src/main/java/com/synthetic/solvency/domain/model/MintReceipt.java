package com.synthetic.solvency.domain.model;

public record MintReceipt(long grossAmount, long fee, long mintedAfterFee, Position position) {
}
