package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Oracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OracleRegistry {

    private final SolvencyState state;
    private final SolvencyProperties properties;

    private final Map<String, Oracle> oracles = new HashMap<>();

    /**
     * Registers or re-activates an oracle. Counters of an existing entry survive.
     */
    public Oracle register(String caller, String oracleId) {
        return state.write("register-oracle", () -> applyRegistration(caller, oracleId));
    }

    Oracle applyRegistration(String caller, String oracleId) {
        state.requireWriteTransaction();
        if (!properties.isAdministrator(caller)) {
            throw new SolvencyException(SolvencyErrorCode.NOT_AUTHORIZED,
                    "only the administrator can register oracles: caller=" + caller);
        }
        if (oracleId == null || oracleId.isBlank()) {
            throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "oracle id is required");
        }
        Oracle existing = oracles.get(oracleId);
        Oracle registered = existing == null
                ? Oracle.registered(oracleId)
                : existing.toBuilder().active(true).build();
        oracles.put(oracleId, registered);
        log.info("[Oracle] 오라클 등록: oracle={}, reactivated={}, submissions={}",
                oracleId, existing != null, registered.getTotalSubmissions());
        return registered;
    }

    public boolean isActive(String oracleId) {
        return state.read(() -> {
            Oracle oracle = oracles.get(oracleId);
            return oracle != null && oracle.isActive();
        });
    }

    public Optional<Oracle> find(String oracleId) {
        return state.read(() -> Optional.ofNullable(oracles.get(oracleId)));
    }

    void requireActive(String oracleId) {
        Oracle oracle = oracles.get(oracleId);
        if (oracle == null) {
            throw new SolvencyException(SolvencyErrorCode.ORACLE_NOT_REGISTERED,
                    "oracle not registered: " + oracleId);
        }
        if (!oracle.isActive()) {
            throw new SolvencyException(SolvencyErrorCode.NOT_AUTHORIZED,
                    "oracle is not active: " + oracleId);
        }
    }

    void recordSubmission(String oracleId) {
        state.requireWriteTransaction();
        Oracle oracle = oracles.get(oracleId);
        if (oracle == null) {
            throw new IllegalStateException("submission recorded for unknown oracle " + oracleId);
        }
        oracles.put(oracleId, oracle.toBuilder()
                .totalSubmissions(FixedPointMath.add(oracle.getTotalSubmissions(), 1))
                .build());
    }
}
