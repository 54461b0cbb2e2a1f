package com.synthetic.solvency.infra.disruptor.handler;

import com.synthetic.solvency.domain.model.SolvencyEventType;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SolvencyPipelineExceptionHandlerTest {

    @Test
    void failuresAreCountedPerEventType() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SolvencyPipelineExceptionHandler handler = new SolvencyPipelineExceptionHandler("solvency-output", registry);
        SolvencyEvent event = new SolvencyEvent();
        event.setType(SolvencyEventType.MINT);

        handler.handleEventException(new IllegalStateException("boom"), 4, event);
        handler.handleEventException(new IllegalStateException("boom"), 5, null);

        assertThat(registry.counter("disruptor.exceptions",
                "pipeline", "solvency-output", "type", "MINT").count()).isEqualTo(1.0);
        assertThat(registry.counter("disruptor.exceptions",
                "pipeline", "solvency-output", "type", "UNKNOWN").count()).isEqualTo(1.0);
    }
}
