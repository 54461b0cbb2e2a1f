package com.synthetic.solvency.domain.exception;

public enum SolvencyErrorCode {

    NOT_AUTHORIZED,
    INSUFFICIENT_COLLATERAL,
    INVALID_AMOUNT,
    POSITION_NOT_FOUND,
    STALE_PRICE,
    LIQUIDATION_NOT_ALLOWED,
    CONTRACT_PAUSED,
    ORACLE_NOT_REGISTERED,
    EXCEEDS_MAX_POSITION,
    ARITHMETIC_ERROR,
    TRANSFER_FAILED
}
