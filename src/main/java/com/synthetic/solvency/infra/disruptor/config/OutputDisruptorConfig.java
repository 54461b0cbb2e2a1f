package com.synthetic.solvency.infra.disruptor.config;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEvent;
import com.synthetic.solvency.infra.disruptor.event.SolvencyEventFactory;
import com.synthetic.solvency.infra.disruptor.handler.SolvencyBroadcastHandler;
import com.synthetic.solvency.infra.disruptor.handler.SolvencyJournalHandler;
import com.synthetic.solvency.infra.disruptor.handler.SolvencyPipelineExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class OutputDisruptorConfig {

    private static final String PIPELINE = "solvency-output";

    private final SolvencyJournalHandler solvencyJournalHandler;
    private final SolvencyBroadcastHandler solvencyBroadcastHandler;
    private final PipelineProperties pipelineProperties;
    private final MeterRegistry meterRegistry;

    private Disruptor<SolvencyEvent> outputDisruptor;

    @Bean
    public Disruptor<SolvencyEvent> solvencyEventDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy(pipelineProperties.getWaitStrategy());
        int bufferSize = Integer.highestOneBit(Math.max(pipelineProperties.getBufferSize(), 64));

        // request threads publish after commit, so more than one producer
        outputDisruptor = new Disruptor<>(
                new SolvencyEventFactory(),
                bufferSize,
                daemonThreads(PIPELINE),
                ProducerType.MULTI,
                waitStrategy
        );
        outputDisruptor.setDefaultExceptionHandler(new SolvencyPipelineExceptionHandler(PIPELINE, meterRegistry));
        outputDisruptor.handleEventsWith(solvencyJournalHandler, solvencyBroadcastHandler);
        outputDisruptor.start();

        log.info("[Disruptor] Output 파이프라인 기동: SolvencyEvent → (Journal || Broadcast) | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
        return outputDisruptor;
    }

    @Bean
    public RingBuffer<SolvencyEvent> solvencyEventRingBuffer(Disruptor<SolvencyEvent> solvencyEventDisruptor) {
        return solvencyEventDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (outputDisruptor != null) {
            outputDisruptor.shutdown();
            log.info("[Disruptor] Output Disruptor 종료 완료");
        }
    }

    static WaitStrategy resolveWaitStrategy(String name) {
        if (name == null) return new SleepingWaitStrategy();
        return switch (name.trim().toLowerCase()) {
            case "yielding" -> new YieldingWaitStrategy();
            case "blocking" -> new BlockingWaitStrategy();
            default -> new SleepingWaitStrategy();
        };
    }

    private ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
