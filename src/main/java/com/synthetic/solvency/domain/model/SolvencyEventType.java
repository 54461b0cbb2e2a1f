package com.synthetic.solvency.domain.model;

public enum SolvencyEventType {

    DEPOSIT,
    MINT,
    DIVERSIFIED_MINT,
    PRICE_SUBMITTED,
    LIQUIDATION,
    ORACLE_REGISTERED,
    PAUSED,
    RESUMED;

    public boolean carriesPosition() {
        return this == DEPOSIT || this == MINT || this == DIVERSIFIED_MINT || this == LIQUIDATION;
    }

    public boolean isAdministrative() {
        return this == ORACLE_REGISTERED || this == PAUSED || this == RESUMED;
    }
}
