package com.synthetic.solvency.domain.model;

public enum DiversifiedOperation {

    MINT,
    DEPOSIT_ONLY;

    public static DiversifiedOperation from(String value) {
        if (value == null) return DEPOSIT_ONLY;
        return switch (value.trim().toUpperCase()) {
            case "MINT" -> MINT;
            default -> DEPOSIT_ONLY;
        };
    }

    public boolean commits() {
        return this == MINT;
    }
}
