package com.synthetic.solvency.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorMetricsCollector {

    private final RingBuffer<SolvencyEvent> solvencyEventRingBuffer;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", solvencyEventRingBuffer, DisruptorMetricsCollector::utilization)
                .tag("pipeline", "solvency-output")
                .description("Solvency output RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", solvencyEventRingBuffer,
                        rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "solvency-output")
                .description("Solvency output RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] Solvency RingBuffer 모니터링 등록 완료: size={}", solvencyEventRingBuffer.getBufferSize());
    }

    @Scheduled(fixedRateString = "${solvency.pipeline.metrics-log-interval-ms:30000}")
    public void logMetricsSummary() {
        long used = solvencyEventRingBuffer.getBufferSize() - solvencyEventRingBuffer.remainingCapacity();
        log.info("[Metrics] Output RB: {}% ({}/{}) | committed={}, rejected={}, handlerErrors={}",
                String.format("%.1f", utilization(solvencyEventRingBuffer) * 100),
                used, solvencyEventRingBuffer.getBufferSize(),
                (long) sumCounters("solvency.operations.committed"),
                (long) sumCounters("solvency.operations.rejected"),
                (long) sumCounters("disruptor.exceptions"));
    }

    private double sumCounters(String name) {
        return meterRegistry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private static double utilization(RingBuffer<SolvencyEvent> ringBuffer) {
        return 1.0 - ((double) ringBuffer.remainingCapacity() / ringBuffer.getBufferSize());
    }
}
