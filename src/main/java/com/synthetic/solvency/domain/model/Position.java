package com.synthetic.solvency.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Position {

    private final String account;
    private final long collateralDeposited;
    private final long syntheticMinted;
    private final long lastInteractionBlock;
    private final Health positionHealth;
    private final boolean liquidationProtected;

    public static Position empty(String account) {
        return Position.builder()
                .account(account)
                .positionHealth(Health.UNBOUNDED)
                .build();
    }

    public boolean hasDebt() {
        return syntheticMinted > 0;
    }
}
