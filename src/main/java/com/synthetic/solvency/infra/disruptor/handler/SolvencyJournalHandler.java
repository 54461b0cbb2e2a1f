package com.synthetic.solvency.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.synthetic.solvency.domain.model.LiquidationRecord;
import com.synthetic.solvency.domain.model.PositionSnapshot;
import com.synthetic.solvency.domain.model.PriceSubmission;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import com.synthetic.solvency.infra.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Journals committed activity to Redis, one pipelined round trip per batch.
 * Only the last snapshot of an account within a batch is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SolvencyJournalHandler implements EventHandler<SolvencyEvent> {

    private final RedisTemplate<String, Object> redisTemplate;

    private final List<PriceSubmission> pendingSubmissions = new ArrayList<>();
    private final List<LiquidationRecord> pendingLiquidations = new ArrayList<>();
    private final Map<String, PositionSnapshot> pendingPositions = new LinkedHashMap<>();

    @Override
    public void onEvent(SolvencyEvent event, long sequence, boolean endOfBatch) {
        bufferEvent(event);

        if (endOfBatch) {
            flush();
        }
    }

    private void bufferEvent(SolvencyEvent event) {
        if (event.getType() == null) return;

        if (event.getSubmission() != null) {
            pendingSubmissions.add(event.getSubmission());
        }
        if (event.getLiquidation() != null) {
            pendingLiquidations.add(event.getLiquidation());
        }
        if (event.getType().carriesPosition() && event.getPosition() != null) {
            pendingPositions.put(event.getPosition().account(), event.getPosition());
        }
    }

    private int pendingOperations() {
        return pendingSubmissions.size() + pendingLiquidations.size() + pendingPositions.size();
    }

    @SuppressWarnings("unchecked")
    private void flush() {
        int totalOps = pendingOperations();
        if (totalOps == 0) return;

        try {
            redisTemplate.executePipelined(new SessionCallback<>() {
                @Override
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    var ops = (RedisOperations<String, Object>) operations;

                    for (PriceSubmission submission : pendingSubmissions) {
                        ops.opsForZSet().add(RedisKeys.PRICE_SUBMISSIONS + submission.assetId(),
                                submission, submission.timestamp());
                        ops.opsForSet().add(RedisKeys.PRICE_ASSETS_SET, submission.assetId());
                    }

                    for (LiquidationRecord record : pendingLiquidations) {
                        ops.opsForZSet().add(RedisKeys.LIQUIDATION_RECORDS, record, record.getLiquidationId());
                    }

                    for (PositionSnapshot snapshot : pendingPositions.values()) {
                        ops.opsForValue().set(RedisKeys.POSITION_LATEST + snapshot.account(), snapshot);
                        ops.opsForSet().add(RedisKeys.POSITION_ACCOUNTS_SET, snapshot.account());
                    }

                    return null;
                }
            });

            log.debug("[Journal] 배치 flush 완료: submissions={}, liquidations={}, positions={}",
                    pendingSubmissions.size(), pendingLiquidations.size(), pendingPositions.size());
        } catch (Exception e) {
            log.error("[Journal] Redis 파이프라인 flush 실패: submissions={}, liquidations={}, positions={}",
                    pendingSubmissions.size(), pendingLiquidations.size(), pendingPositions.size(), e);
        } finally {
            pendingSubmissions.clear();
            pendingLiquidations.clear();
            pendingPositions.clear();
        }
    }
}
