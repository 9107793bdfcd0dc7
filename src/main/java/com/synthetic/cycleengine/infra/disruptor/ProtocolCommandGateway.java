package com.synthetic.cycleengine.infra.disruptor;

import com.lmax.disruptor.RingBuffer;
import com.synthetic.cycleengine.infra.config.ProtocolProperties;
import com.synthetic.cycleengine.infra.disruptor.event.ProtocolCommandEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for every state-changing call. Commands are queued on the
 * command ring buffer and the caller blocks until the single consumer has run
 * them; a {@link RuntimeException} thrown by the command reaches the caller
 * unchanged.
 */
@Slf4j
@Component
public class ProtocolCommandGateway {

    private final RingBuffer<ProtocolCommandEvent> ringBuffer;
    private final Duration timeout;

    public ProtocolCommandGateway(RingBuffer<ProtocolCommandEvent> commandRingBuffer,
                                  ProtocolProperties protocolProperties) {
        this.ringBuffer = commandRingBuffer;
        this.timeout = protocolProperties.getCommandTimeout();
    }

    /**
     * Queues the command and returns its completion. The future fails with the
     * exception the command threw.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> submit(String symbol, String command, Supplier<T> action) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        ringBuffer.publishEvent((event, sequence) -> {
            event.setSymbol(symbol);
            event.setCommand(command);
            event.setAction(action);
            event.setResult(result);
            event.setPublishNanoTime(System.nanoTime());
        });
        return (CompletableFuture<T>) (CompletableFuture<?>) result;
    }

    /**
     * Runs the command and waits for it. A timeout only stops the wait: the
     * command stays queued and may still be applied afterwards. Callers that
     * need the final outcome use {@link #submit}.
     */
    public <T> T execute(String symbol, String command, Supplier<T> action) {
        CompletableFuture<T> result = submit(symbol, command, action);
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("command " + command + " failed", cause);
        } catch (TimeoutException e) {
            log.error("[Gateway] {} {} timed out after {}, still queued", symbol, command, timeout);
            throw new IllegalStateException("command " + command + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for " + command, e);
        }
    }

    public void run(String symbol, String command, Runnable action) {
        execute(symbol, command, () -> {
            action.run();
            return null;
        });
    }
}
