package com.synthetic.cycleengine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class ProtocolCommandEventFactory implements EventFactory<ProtocolCommandEvent> {

    @Override
    public ProtocolCommandEvent newInstance() {
        return new ProtocolCommandEvent();
    }
}
