package com.synthetic.cycleengine.infra.archive;

import com.synthetic.cycleengine.domain.model.CycleHistoryRecord;
import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.repository.CycleHistoryRepository;
import com.synthetic.cycleengine.domain.service.CycleEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Persists every finalized or halted cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CycleArchiveListener implements CycleEventListener {

    private final CycleHistoryRepository repository;

    @Override
    public void onTransition(CycleTransition transition) {
        if (transition.snapshot() == null) {
            return;
        }
        CycleHistoryRecord saved = repository.save(CycleHistoryRecord.from(transition.symbol(), transition.snapshot()));
        log.info("[Archive] {} cycle {} archived as {} (id={})",
                transition.symbol(), saved.getCycle(), saved.getOutcome(), saved.getId());
    }
}
