package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.CapabilityService;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.external.SyntheticToken;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

@Slf4j
public class AssetPoolFactory {

    static final String CUSTODY_PREFIX = "pool:";

    private final ProtocolPolicy policy;
    private final CapabilityService capabilities;
    private final ReserveToken reserve;
    private final CycleTimings timings;
    private final Clock clock;

    public AssetPoolFactory(ProtocolPolicy policy, CapabilityService capabilities, ReserveToken reserve,
                            CycleTimings timings, Clock clock) {
        this.policy = policy;
        this.capabilities = capabilities;
        this.reserve = reserve;
        this.timings = timings;
        this.clock = clock;
    }

    public AssetPool create(String symbol, AssetOracle oracle, SyntheticToken token, List<CycleEventListener> listeners) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("pool symbol is required");
        }
        String normalized = symbol.toUpperCase();
        String custody = CUSTODY_PREFIX + normalized;

        CycleBook book = new CycleBook(normalized, clock.instant());
        LiquidityProviderLedger liquidity =
                new LiquidityProviderLedger(book, policy, oracle, token, reserve, capabilities, custody);
        UserLedger users = new UserLedger(book, policy, oracle, token, reserve, liquidity, custody);
        CycleOrchestrator orchestrator = new CycleOrchestrator(book, policy, oracle, token, reserve,
                capabilities, users, liquidity, timings, clock, custody);
        listeners.forEach(orchestrator::addListener);

        log.info("[PoolFactory] pool {} created: custody={}, token={}, reserve={}, cycleLength={}",
                normalized, custody, token.symbol(), reserve.symbol(), timings.cycleLength());
        return new AssetPool(normalized, custody, book, users, liquidity, orchestrator, oracle, token);
    }
}
