package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.model.CycleTransition;

/**
 * Notified on the command thread after each cycle state change.
 */
@FunctionalInterface
public interface CycleEventListener {

    void onTransition(CycleTransition transition);
}
