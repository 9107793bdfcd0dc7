package com.synthetic.cycleengine.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEvent;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CommandQueueMetrics {

    private final RingBuffer<ProtocolCommandEvent> ringBuffer;
    private final MeterRegistry meterRegistry;

    public CommandQueueMetrics(RingBuffer<ProtocolCommandEvent> commandRingBuffer, MeterRegistry meterRegistry) {
        this.ringBuffer = commandRingBuffer;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", ringBuffer,
                        rb -> 1.0 - ((double) rb.remainingCapacity() / rb.getBufferSize()))
                .tag("pipeline", "command")
                .description("Command RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", ringBuffer, rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "command")
                .description("Command RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] command RingBuffer gauges registered");
    }
}
