package com.synthetic.cycleengine.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "cycle_history_record", indexes = {
        @Index(name = "idx_cycle_history_symbol_cycle", columnList = "symbol, cycle")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String symbol;
    private long cycle;

    @Enumerated(EnumType.STRING)
    private CycleState outcome;

    @Column(precision = 38, scale = 18)
    private BigDecimal settlementPrice;
    @Column(precision = 38, scale = 18)
    private BigDecimal interestIndex;
    @Column(precision = 38, scale = 18)
    private BigDecimal depositTotal;
    @Column(precision = 38, scale = 18)
    private BigDecimal redemptionValue;
    @Column(precision = 38, scale = 18)
    private BigDecimal interestCollected;
    @Column(precision = 38, scale = 18)
    private BigDecimal netFlow;
    @Column(precision = 38, scale = 18)
    private BigDecimal totalCommitted;

    private long startedEpochMs;
    private long closedEpochMs;

    public static CycleHistoryRecord from(String symbol, CycleSnapshot snapshot) {
        return CycleHistoryRecord.builder()
                .symbol(symbol)
                .cycle(snapshot.cycle())
                .outcome(snapshot.outcome())
                .settlementPrice(snapshot.settlementPrice())
                .interestIndex(snapshot.interestIndex())
                .depositTotal(snapshot.depositTotal())
                .redemptionValue(snapshot.redemptionValue())
                .interestCollected(snapshot.interestCollected())
                .netFlow(snapshot.netFlow())
                .totalCommitted(snapshot.totalCommitted())
                .startedEpochMs(snapshot.startedAt() != null ? snapshot.startedAt().toEpochMilli() : 0L)
                .closedEpochMs(snapshot.closedAt() != null ? snapshot.closedAt().toEpochMilli() : 0L)
                .build();
    }
}
