package com.synthetic.solvency.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Oracle {

    public static final long INITIAL_CREDIBILITY = 100;

    private final String oracleId;
    private final boolean active;
    private final long totalSubmissions;
    private final long credibilityScore;

    public static Oracle registered(String oracleId) {
        return Oracle.builder()
                .oracleId(oracleId)
                .active(true)
                .totalSubmissions(0)
                .credibilityScore(INITIAL_CREDIBILITY)
                .build();
    }
}
