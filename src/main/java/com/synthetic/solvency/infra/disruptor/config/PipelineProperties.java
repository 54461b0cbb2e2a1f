package com.synthetic.solvency.infra.disruptor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "solvency.pipeline")
public class PipelineProperties {

    private int bufferSize = 1024 * 16;

    /**
     * sleeping, yielding or blocking.
     */
    private String waitStrategy = "sleeping";

    private long metricsLogIntervalMs = 30_000;
}
