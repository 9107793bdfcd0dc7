package com.synthetic.cycleengine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer that runs every state-changing command, so pool state is only
 * ever touched from this thread.
 */
@Slf4j
@Component
public class CommandExecutionHandler implements EventHandler<ProtocolCommandEvent> {

    private final MeterRegistry meterRegistry;

    public CommandExecutionHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onEvent(ProtocolCommandEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<Object> result = event.getResult();
        String outcome = "ok";
        try {
            Object value = event.getAction().get();
            result.complete(value);
        } catch (ProtocolException e) {
            outcome = e.getKind().name().toLowerCase();
            log.debug("[Command] {} {} rejected: {} {}", event.getSymbol(), event.getCommand(), e.getCode(), e.getMessage());
            result.completeExceptionally(e);
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("[Command] {} {} failed (seq={})", event.getSymbol(), event.getCommand(), sequence, e);
            result.completeExceptionally(e);
        } finally {
            Timer.builder("protocol.command.duration")
                    .tag("command", event.getCommand() != null ? event.getCommand() : "unknown")
                    .tag("outcome", outcome)
                    .description("Queue-to-completion latency of protocol commands")
                    .register(meterRegistry)
                    .record(System.nanoTime() - event.getPublishNanoTime(), TimeUnit.NANOSECONDS);
            event.clear();
        }
    }
}
