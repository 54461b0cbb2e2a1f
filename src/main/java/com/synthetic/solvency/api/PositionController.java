package com.synthetic.solvency.api;

import com.synthetic.solvency.api.dto.AmountRequest;
import com.synthetic.solvency.api.dto.DiversifiedRequest;
import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.DiversifiedOperation;
import com.synthetic.solvency.domain.model.DiversifiedPositionRequest;
import com.synthetic.solvency.domain.model.DiversifiedPositionResult;
import com.synthetic.solvency.domain.model.Position;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.port.CallerIdentityResolver;
import com.synthetic.solvency.domain.port.LogicalClock;
import com.synthetic.solvency.domain.service.DiversifiedPositionManager;
import com.synthetic.solvency.domain.service.LiquidationEngine;
import com.synthetic.solvency.domain.service.MintingEngine;
import com.synthetic.solvency.domain.service.PositionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/position")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PositionController {

    private final MintingEngine mintingEngine;
    private final DiversifiedPositionManager diversifiedPositionManager;
    private final PositionLedger positionLedger;
    private final LiquidationEngine liquidationEngine;
    private final CallerIdentityResolver callerIdentityResolver;
    private final LogicalClock logicalClock;

    @PostMapping("/deposit")
    public ResponseEntity<Map<String, Object>> deposit(@RequestBody AmountRequest request) {
        String caller = callerIdentityResolver.currentCaller();
        long amount = RequestValues.required(request.amount(), "amount");

        Position position = mintingEngine.deposit(caller, amount, logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "position", PositionSnapshot.from(position)));
    }

    @PostMapping("/mint")
    public ResponseEntity<Map<String, Object>> mint(@RequestBody AmountRequest request) {
        String caller = callerIdentityResolver.currentCaller();
        long amount = RequestValues.required(request.amount(), "amount");

        long minted = mintingEngine.mint(caller, amount, logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "minted", minted,
                "fee", amount - minted));
    }

    @PostMapping("/diversified")
    public ResponseEntity<Map<String, Object>> diversified(@RequestBody DiversifiedRequest request) {
        String caller = callerIdentityResolver.currentCaller();
        DiversifiedPositionRequest command = new DiversifiedPositionRequest(
                caller,
                request.assetIds(),
                request.amounts(),
                DiversifiedOperation.from(request.operation()),
                request.syntheticAmount() == null ? 0L : request.syntheticAmount(),
                request.riskScores());

        DiversifiedPositionResult result = diversifiedPositionManager.manage(command, logicalClock.currentBlock());

        log.info("[Position API] 분산 포지션 요청 처리: account={}, operation={}, committed={}",
                caller, command.operation(), result.committed());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("healthRatio", result.healthRatio().wireValue());
        body.put("diversificationBonus", result.diversificationBonus());
        body.put("maxAdditionalMintable", result.maxAdditionalMintable());
        body.put("avgRiskScore", result.avgRiskScore());
        body.put("collateralLocked", result.collateralLocked());
        body.put("committed", result.committed());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{account}")
    public ResponseEntity<Map<String, Object>> getPosition(@PathVariable String account) {
        Position position = positionLedger.get(account)
                .orElseThrow(() -> new SolvencyException(SolvencyErrorCode.POSITION_NOT_FOUND,
                        "no position for " + account));

        return ResponseEntity.ok(Map.of(
                "success", true,
                "position", PositionSnapshot.from(position),
                "maxAdditionalMintable", mintingEngine.maxAdditionalMintable(account),
                "liquidatable", liquidationEngine.isLiquidatable(account)));
    }
}
