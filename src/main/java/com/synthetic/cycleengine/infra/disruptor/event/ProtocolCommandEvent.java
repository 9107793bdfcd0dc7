package com.synthetic.cycleengine.infra.disruptor.event;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

public class ProtocolCommandEvent {

    private String symbol;
    private String command;
    private Supplier<?> action;
    private CompletableFuture<Object> result;
    private long publishNanoTime;

    public void clear() {
        symbol = null;
        command = null;
        action = null;
        result = null;
        publishNanoTime = 0L;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public Supplier<?> getAction() {
        return action;
    }

    public void setAction(Supplier<?> action) {
        this.action = action;
    }

    public CompletableFuture<Object> getResult() {
        return result;
    }

    public void setResult(CompletableFuture<Object> result) {
        this.result = result;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "ProtocolCommandEvent{symbol=" + symbol + ", command=" + command + "}";
    }
}
