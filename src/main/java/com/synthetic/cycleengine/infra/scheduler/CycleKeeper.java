package com.synthetic.cycleengine.infra.scheduler;

import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.model.CycleState;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolRegistry;
import com.synthetic.cycleengine.domain.service.CycleOrchestrator;
import com.synthetic.cycleengine.infra.config.ProtocolProperties;
import com.synthetic.cycleengine.infra.disruptor.ProtocolCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Moves every pool into the next rebalancing phase once its deadline has
 * passed. A rejected transition is logged and retried on the next tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CycleKeeper {

    private final AssetPoolRegistry registry;
    private final ProtocolCommandGateway gateway;
    private final ProtocolProperties properties;

    @Scheduled(fixedDelayString = "${protocol.keeper.interval-ms:60000}",
            initialDelayString = "${protocol.keeper.interval-ms:60000}")
    public void tick() {
        if (!properties.getKeeper().isEnabled()) {
            return;
        }
        for (AssetPool pool : registry.all()) {
            try {
                CycleState reached = gateway.execute(pool.symbol(), "keeper.advance", () -> advance(pool));
                if (reached != null) {
                    log.info("[Keeper] {} advanced to {}", pool.symbol(), reached);
                }
            } catch (ProtocolException e) {
                log.info("[Keeper] {} not advanced: {} {}", pool.symbol(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Keeper] {} tick failed", pool.symbol(), e);
            }
        }
    }

    /** @return the state reached, or null when nothing was due */
    CycleState advance(AssetPool pool) {
        CycleOrchestrator orchestrator = pool.orchestrator();
        if (!orchestrator.isTransitionDue()) {
            return null;
        }
        switch (pool.book().getState()) {
            case ACTIVE -> orchestrator.initiateOffchainRebalance();
            case REBALANCING_OFFCHAIN -> orchestrator.initiateOnchainRebalance();
            default -> {
                return null;
            }
        }
        return pool.book().getState();
    }
}
