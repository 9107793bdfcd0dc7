package com.synthetic.cycleengine.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.synthetic.cycleengine.infra.config.ProtocolProperties;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEvent;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEventFactory;
import com.synthetic.cycleengine.infra.disruptor.handler.CommandExecutionHandler;
import com.synthetic.cycleengine.infra.disruptor.handler.DisruptorExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CommandDisruptorConfig {

    private final CommandExecutionHandler commandExecutionHandler;
    private final ProtocolProperties protocolProperties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<ProtocolCommandEvent> commandDisruptor;

    @Bean
    public Disruptor<ProtocolCommandEvent> commandDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy();
        int bufferSize = protocolProperties.getCommandBufferSize();

        commandDisruptor = new Disruptor<>(
                new ProtocolCommandEventFactory(),
                bufferSize,
                namedThreadFactory("disruptor-command"),
                ProducerType.MULTI,
                waitStrategy
        );

        commandDisruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler("command", meterRegistry));
        commandDisruptor.handleEventsWith(commandExecutionHandler);
        commandDisruptor.start();

        log.info("[Disruptor] command pipeline started | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
        return commandDisruptor;
    }

    @Bean
    public RingBuffer<ProtocolCommandEvent> commandRingBuffer(Disruptor<ProtocolCommandEvent> commandDisruptor) {
        return commandDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (commandDisruptor != null) {
            log.info("[Disruptor] shutting down command pipeline");
            commandDisruptor.shutdown();
        }
    }

    private WaitStrategy resolveWaitStrategy() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                log.info("[Disruptor] prod profile -> YieldingWaitStrategy");
                return new YieldingWaitStrategy();
            }
        }
        log.info("[Disruptor] dev/local profile -> SleepingWaitStrategy");
        return new SleepingWaitStrategy();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
