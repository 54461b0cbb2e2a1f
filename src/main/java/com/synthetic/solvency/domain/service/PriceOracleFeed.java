package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.model.PriceQuote;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.domain.port.SolvencyEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts oracle price submissions. Submissions are keyed per asset for
 * audit, but every accepted one overwrites the same single current price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceOracleFeed {

    private final SolvencyState state;
    private final OracleRegistry oracleRegistry;
    private final SolvencyProperties properties;
    private final SolvencyEventPublisher eventPublisher;

    private final Map<SubmissionKey, PriceSubmission> submissions = new HashMap<>();
    private long submissionNonce;
    private long currentPrice;
    private long lastPriceUpdate;

    public long submit(String oracleId, String assetId, long price, long confidence, long now) {
        PriceSubmission accepted = state.write("submit-price", () -> {
            oracleRegistry.requireActive(oracleId);
            state.requireNotPaused();
            if (confidence < properties.getMinOracleConfidence()) {
                throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT,
                        "confidence " + confidence + " below minimum " + properties.getMinOracleConfidence());
            }
            if (price <= 0) {
                throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "price must be positive");
            }
            if (confidence > 100) {
                throw new SolvencyException(SolvencyErrorCode.INVALID_AMOUNT, "confidence is a percentage");
            }

            long submissionId = FixedPointMath.add(submissionNonce, 1);
            PriceSubmission submission = new PriceSubmission(
                    assetId, submissionId, oracleId, price, confidence, now);

            oracleRegistry.recordSubmission(oracleId);
            submissions.put(new SubmissionKey(assetId, submissionId), submission);
            submissionNonce = submissionId;
            currentPrice = price;
            lastPriceUpdate = now;
            eventPublisher.priceSubmitted(submission);
            return submission;
        });

        log.info("[Feed] 가격 반영: asset={}, id={}, oracle={}, price={}, confidence={}, block={}",
                assetId, accepted.submissionId(), oracleId, price, confidence, now);
        return accepted.submissionId();
    }

    public long getCurrentPrice() {
        return state.read(() -> currentPrice);
    }

    public PriceQuote currentQuote() {
        return state.read(() -> new PriceQuote(currentPrice, lastPriceUpdate));
    }

    public long getSubmissionNonce() {
        return state.read(() -> submissionNonce);
    }

    public Optional<PriceSubmission> findSubmission(String assetId, long submissionId) {
        return state.read(() -> Optional.ofNullable(submissions.get(new SubmissionKey(assetId, submissionId))));
    }

    public boolean isFresh(long lastUpdate, long now) {
        return FixedPointMath.isFresh(lastUpdate, now, properties.getOracleStalenessLimit());
    }

    public void requireFresh(PriceQuote quote, long now) {
        if (!isFresh(quote.lastUpdate(), now)) {
            throw new SolvencyException(SolvencyErrorCode.STALE_PRICE,
                    "price last updated at block " + quote.lastUpdate() + ", now " + now);
        }
    }

    private record SubmissionKey(String assetId, long submissionId) {
    }
}
