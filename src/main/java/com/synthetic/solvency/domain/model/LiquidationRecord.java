package com.synthetic.solvency.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiquidationRecord {

    private long liquidationId;
    private String account;
    private String liquidator;
    private long collateralSeized;
    private long penalty;
    private long debtCovered;
    private long reward;
    private long blockHeight;
}
