package com.synthetic.solvency.api;

import com.synthetic.solvency.api.dto.PriceSubmissionRequest;
import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.Oracle;
import com.synthetic.solvency.domain.model.PriceQuote;
import com.synthetic.solvency.domain.port.CallerIdentityResolver;
import com.synthetic.solvency.domain.port.LogicalClock;
import com.synthetic.solvency.domain.service.OracleRegistry;
import com.synthetic.solvency.domain.service.PriceOracleFeed;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/oracle")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class OracleController {

    private final PriceOracleFeed priceOracleFeed;
    private final OracleRegistry oracleRegistry;
    private final CallerIdentityResolver callerIdentityResolver;
    private final LogicalClock logicalClock;

    @PostMapping("/submit")
    public ResponseEntity<Map<String, Object>> submit(@RequestBody PriceSubmissionRequest request) {
        String oracleId = callerIdentityResolver.currentCaller();
        String assetId = RequestValues.required(request.assetId(), "assetId");
        long price = RequestValues.required(request.price(), "price");
        long confidence = RequestValues.required(request.confidence(), "confidence");

        long submissionId = priceOracleFeed.submit(oracleId, assetId, price, confidence, logicalClock.currentBlock());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "submissionId", submissionId));
    }

    @GetMapping("/price")
    public ResponseEntity<Map<String, Object>> currentPrice() {
        PriceQuote quote = priceOracleFeed.currentQuote();
        long now = logicalClock.currentBlock();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "price", quote.price(),
                "lastUpdate", quote.lastUpdate(),
                "fresh", quote.price() > 0 && priceOracleFeed.isFresh(quote.lastUpdate(), now),
                "block", now));
    }

    @GetMapping("/{oracleId}")
    public ResponseEntity<Map<String, Object>> getOracle(@PathVariable String oracleId) {
        Oracle oracle = oracleRegistry.find(oracleId)
                .orElseThrow(() -> new SolvencyException(SolvencyErrorCode.ORACLE_NOT_REGISTERED,
                        "oracle not registered: " + oracleId));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "oracleId", oracle.getOracleId(),
                "active", oracle.isActive(),
                "totalSubmissions", oracle.getTotalSubmissions(),
                "credibilityScore", oracle.getCredibilityScore()));
    }

    @GetMapping("/submission/{assetId}/{submissionId}")
    public ResponseEntity<Map<String, Object>> getSubmission(@PathVariable String assetId,
                                                             @PathVariable long submissionId) {
        return priceOracleFeed.findSubmission(assetId, submissionId)
                .map(submission -> ResponseEntity.ok(Map.<String, Object>of(
                        "success", true,
                        "submission", submission)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "message", "제출 내역이 없습니다: asset=" + assetId + ", id=" + submissionId)));
    }
}
