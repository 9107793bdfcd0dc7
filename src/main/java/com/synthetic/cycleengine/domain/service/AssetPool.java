package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.SyntheticToken;

/**
 * One independently owned pool: its cycle book, both ledgers, the orchestrator
 * and the asset-specific collaborators. Policy, capabilities and the reserve
 * token are shared between pools.
 *
 * @param custody reserve account holding this pool's escrow and collateral
 */
public record AssetPool(
        String symbol,
        String custody,
        CycleBook book,
        UserLedger users,
        LiquidityProviderLedger liquidity,
        CycleOrchestrator orchestrator,
        AssetOracle oracle,
        SyntheticToken token
) {
}
