package com.synthetic.cycleengine.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Last line for errors that escape {@link CommandExecutionHandler}. The waiting
 * caller is released with the error and the pipeline keeps running.
 */
@Slf4j
public class DisruptorExceptionHandler implements ExceptionHandler<ProtocolCommandEvent> {

    private final String pipelineName;
    private final Counter exceptionCounter;

    public DisruptorExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        this.exceptionCounter = Counter.builder("disruptor.exceptions")
                .tag("pipeline", pipelineName)
                .description("Command pipeline exception count")
                .register(meterRegistry);
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, ProtocolCommandEvent event) {
        exceptionCounter.increment();
        log.error("[Disruptor-{}] command failed outside the handler (seq={}, event={})",
                pipelineName, sequence, event, ex);
        if (event != null && event.getResult() != null) {
            event.getResult().completeExceptionally(ex);
            event.clear();
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor-{}] handler start failed", pipelineName, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor-{}] handler shutdown failed", pipelineName, ex);
    }
}
