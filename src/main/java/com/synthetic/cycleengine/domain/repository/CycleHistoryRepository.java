package com.synthetic.cycleengine.domain.repository;

import com.synthetic.cycleengine.domain.model.CycleHistoryRecord;
import com.synthetic.cycleengine.domain.model.CycleState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CycleHistoryRepository extends JpaRepository<CycleHistoryRecord, Long> {

    List<CycleHistoryRecord> findBySymbolOrderByCycleDesc(String symbol);

    Optional<CycleHistoryRecord> findBySymbolAndCycle(String symbol, long cycle);

    long countBySymbolAndOutcome(String symbol, CycleState outcome);
}
