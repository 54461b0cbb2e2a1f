package com.synthetic.solvency.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class SolvencyEventFactory implements EventFactory<SolvencyEvent> {

    @Override
    public SolvencyEvent newInstance() {
        return new SolvencyEvent();
    }
}
