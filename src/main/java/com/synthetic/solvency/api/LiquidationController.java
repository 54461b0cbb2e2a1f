package com.synthetic.solvency.api;

import com.synthetic.solvency.api.dto.LiquidationRequest;
import com.synthetic.solvency.domain.port.CallerIdentityResolver;
import com.synthetic.solvency.domain.port.LogicalClock;
import com.synthetic.solvency.domain.service.LiquidationEngine;
import com.synthetic.solvency.infra.redis.service.SolvencyJournalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/liquidation")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LiquidationController {

    private static final int MAX_JOURNAL_LIMIT = 500;

    private final LiquidationEngine liquidationEngine;
    private final SolvencyJournalService journalService;
    private final CallerIdentityResolver callerIdentityResolver;
    private final LogicalClock logicalClock;

    @PostMapping
    public ResponseEntity<Map<String, Object>> liquidate(@RequestBody LiquidationRequest request) {
        String liquidator = callerIdentityResolver.currentCaller();
        String account = RequestValues.required(request.account(), "account");
        long debtToCover = RequestValues.required(request.debtToCover(), "debtToCover");

        long liquidationId = liquidationEngine.liquidate(liquidator, account, debtToCover, logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "liquidationId", liquidationId));
    }

    @GetMapping("/{liquidationId}")
    public ResponseEntity<Map<String, Object>> getLiquidation(@PathVariable long liquidationId) {
        return liquidationEngine.find(liquidationId)
                .map(record -> ResponseEntity.ok(Map.<String, Object>of(
                        "success", true,
                        "record", record)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "message", "청산 기록이 없습니다: id=" + liquidationId)));
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> history(@RequestParam(required = false) String account) {
        var records = liquidationEngine.history(account);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "count", records.size(),
                "records", records));
    }

    @GetMapping("/journal")
    public ResponseEntity<Map<String, Object>> journal(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_JOURNAL_LIMIT));
        var records = journalService.getRecentLiquidations(bounded);
        log.debug("[Liquidation API] 저널 조회: limit={}, count={}", bounded, records.size());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "count", records.size(),
                "records", records));
    }
}
