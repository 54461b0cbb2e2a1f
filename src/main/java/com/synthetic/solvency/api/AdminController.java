package com.synthetic.solvency.api;

import com.synthetic.solvency.domain.model.Oracle;
import com.synthetic.solvency.domain.port.CallerIdentityResolver;
import com.synthetic.solvency.domain.port.LogicalClock;
import com.synthetic.solvency.domain.service.AdminService;
import com.synthetic.solvency.domain.service.SolvencyQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AdminController {

    private final AdminService adminService;
    private final SolvencyQueryService queryService;
    private final CallerIdentityResolver callerIdentityResolver;
    private final LogicalClock logicalClock;

    @PostMapping("/oracle/{oracleId}")
    public ResponseEntity<Map<String, Object>> registerOracle(@PathVariable String oracleId) {
        Oracle oracle = adminService.registerOracle(
                callerIdentityResolver.currentCaller(), oracleId, logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "oracleId", oracle.getOracleId(),
                "active", oracle.isActive()));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause() {
        adminService.pause(callerIdentityResolver.currentCaller(), logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of("success", true, "paused", true));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        adminService.resume(callerIdentityResolver.currentCaller(), logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of("success", true, "paused", false));
    }

    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> state() {
        SolvencyQueryService.StateReport report = queryService.stateReport();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "block", logicalClock.currentBlock(),
                "state", report.state(),
                "positionCount", report.reconciliation().positionCount(),
                "collateralDrift", report.reconciliation().collateralDrift()));
    }
}
