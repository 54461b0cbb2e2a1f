package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Oracle;
import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final SolvencyState state;
    private final OracleRegistry oracleRegistry;
    private final SolvencyProperties properties;
    private final SolvencyEventPublisher eventPublisher;

    public Oracle registerOracle(String caller, String oracleId, long now) {
        return state.write("register-oracle", () -> {
            Oracle oracle = oracleRegistry.applyRegistration(caller, oracleId);
            eventPublisher.administrative(SolvencyEventType.ORACLE_REGISTERED, caller, oracleId, now);
            return oracle;
        });
    }

    public void pause(String caller, long now) {
        togglePause(caller, true, now);
    }

    public void resume(String caller, long now) {
        togglePause(caller, false, now);
    }

    private void togglePause(String caller, boolean paused, long now) {
        String operation = paused ? "pause" : "resume";
        state.write(operation, () -> {
            if (!properties.isAdministrator(caller)) {
                throw new SolvencyException(SolvencyErrorCode.NOT_AUTHORIZED,
                        "only the administrator can " + operation + ": caller=" + caller);
            }
            state.commitPaused(paused);
            eventPublisher.administrative(paused ? SolvencyEventType.PAUSED : SolvencyEventType.RESUMED,
                    caller, operation, now);
            return paused;
        });

        log.warn("[Admin] 서킷 브레이커 {}: caller={}, block={}", paused ? "작동" : "해제", caller, now);
    }
}
