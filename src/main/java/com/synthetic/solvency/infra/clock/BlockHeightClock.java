package com.synthetic.solvency.infra.clock;

import com.synthetic.solvency.domain.port.LogicalClock;
import com.synthetic.solvency.domain.service.SolvencyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class BlockHeightClock implements LogicalClock {

    private final AtomicLong height;

    public BlockHeightClock(SolvencyProperties properties) {
        this.height = new AtomicLong(properties.getClock().getGenesisBlock());
    }

    @Override
    public long currentBlock() {
        return height.get();
    }

    @Scheduled(fixedRateString = "${solvency.clock.block-interval-ms:10000}")
    public void advance() {
        long block = height.incrementAndGet();
        if (block % 100 == 0) {
            log.debug("[Clock] 블록 높이: {}", block);
        }
    }
}
