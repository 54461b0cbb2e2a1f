package com.synthetic.solvency.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumer failures are counted per event type and dropped; the state the
 * event describes is already committed.
 */
@Slf4j
public class SolvencyPipelineExceptionHandler implements ExceptionHandler<SolvencyEvent> {

    private final String pipelineName;
    private final MeterRegistry meterRegistry;

    public SolvencyPipelineExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, SolvencyEvent event) {
        String type = event != null && event.getType() != null ? event.getType().name() : "UNKNOWN";
        meterRegistry.counter("disruptor.exceptions", "pipeline", pipelineName, "type", type).increment();
        log.error("[Disruptor-{}] {} 이벤트 처리 예외 (seq={}, block={}). 드롭 후 계속 진행.",
                pipelineName, type, sequence, event != null ? event.getBlock() : -1, ex);
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 시작 예외", pipelineName, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 종료 예외", pipelineName, ex);
    }
}
