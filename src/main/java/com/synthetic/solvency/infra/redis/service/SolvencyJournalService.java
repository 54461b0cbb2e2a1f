package com.synthetic.solvency.infra.redis.service;

import com.synthetic.solvency.infra.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Read side of the Redis journal. Values come back as whatever the JSON
 * serializer rebuilt, so they are returned untyped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SolvencyJournalService {

    private final RedisTemplate<String, Object> redisTemplate;

    public List<Object> getRecentLiquidations(int limit) {
        if (limit <= 0) return Collections.emptyList();
        try {
            Set<Object> results = redisTemplate.opsForZSet()
                    .reverseRange(RedisKeys.LIQUIDATION_RECORDS, 0, limit - 1L);
            if (results == null || results.isEmpty()) return Collections.emptyList();
            return new ArrayList<>(results);
        } catch (RuntimeException e) {
            log.warn("[Redis] 청산 저널 조회 실패: limit={}", limit, e);
            return Collections.emptyList();
        }
    }
}
