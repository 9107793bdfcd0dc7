package com.synthetic.cycleengine.infra.archive;

import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.service.CycleEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CycleMetricsListener implements CycleEventListener {

    private final MeterRegistry meterRegistry;

    @Override
    public void onTransition(CycleTransition transition) {
        Counter.builder("protocol.cycle.transitions")
                .tag("symbol", transition.symbol())
                .tag("to", transition.to().name())
                .description("Cycle state transitions per pool")
                .register(meterRegistry)
                .increment();
    }
}
