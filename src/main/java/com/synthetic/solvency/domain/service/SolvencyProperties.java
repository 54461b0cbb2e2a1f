package com.synthetic.solvency.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "solvency")
public class SolvencyProperties {

    private String administrator = "protocol-admin";

    private long minCollateralRatio = 150;
    private long liquidationThreshold = 120;
    private long liquidationBonus = 10;
    private long liquidationPenalty = 5;
    private long mintingFeeBps = 50;
    private long minOracleConfidence = 60;
    private long oracleStalenessLimit = 100;
    private long cooldownBlocks = 10;
    private long maxPositionPercentage = 10;

    private int maxDiversifiedAssets = 5;
    private long minAverageRiskScore = 50;
    private long diversificationBonusSmall = 5;
    private long diversificationBonusLarge = 10;
    private long protectionBonusThreshold = 8;

    private long reconciliationIntervalMs = 300_000;

    private Custody custody = new Custody();
    private Clock clock = new Clock();

    public boolean isAdministrator(String caller) {
        return caller != null && caller.equals(administrator);
    }

    @Getter
    @Setter
    public static class Custody {
        private String identity = "protocol-custody";
        private long initialBalance = 1_000_000_000_000L;
    }

    @Getter
    @Setter
    public static class Clock {
        private long blockIntervalMs = 10_000;
        private long genesisBlock = 0;
    }
}
