package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.LiquidityPosition;
import com.synthetic.cycleengine.domain.model.LiquidityRequestType;
import com.synthetic.cycleengine.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.synthetic.cycleengine.support.PoolFixture.ADMIN;
import static com.synthetic.cycleengine.support.PoolFixture.dec;
import static com.synthetic.cycleengine.support.ProtocolAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class LiquidityProviderLedgerTest {

    private PoolFixture f;
    private LiquidityProviderLedger lps;

    @BeforeEach
    void setUp() {
        f = new PoolFixture();
        lps = f.lps();
    }

    @Test
    void onlyAllowListedAccountsCanProvideLiquidity() {
        f.fund("mallory", "1000");

        assertRejected(ErrorCode.NOT_AUTHORIZED, () -> lps.deposit("mallory", dec("1000")));
        assertThat(lps.position("mallory")).isEmpty();
    }

    @Test
    void commitmentNeedsHalfItsSizeInCollateral() {
        f.fund("lp1", "40000");
        lps.deposit("lp1", dec("40000"));

        assertRejected(ErrorCode.INSUFFICIENT_COLLATERAL, () -> lps.addLiquidity("lp1", dec("100000")));
        lps.addLiquidity("lp1", dec("80000"));
        assertThat(lps.request("lp1").type()).isEqualTo(LiquidityRequestType.ADD_LIQUIDITY);
    }

    @Test
    void commitmentTakesEffectWhenTheCycleCloses() {
        f.commit("lp1", "60000", "100000");
        assertThat(lps.position("lp1").orElseThrow().getLiquidityCommitment()).isEqualByComparingTo("0");
        assertThat(f.book().getPendingLiquidityAdds()).isEqualByComparingTo("100000");

        f.runCycle("100");

        assertThat(lps.position("lp1").orElseThrow().getLiquidityCommitment()).isEqualByComparingTo("100000");
        assertThat(f.book().getTotalCommitted()).isEqualByComparingTo("100000");
        assertThat(f.book().getPendingLiquidityAdds()).isEqualByComparingTo("0");
        assertThat(lps.request("lp1").type()).isEqualTo(LiquidityRequestType.NONE);
    }

    @Test
    void cancelledAddLeavesNoPendingLiquidity() {
        f.commit("lp1", "60000", "100000");

        lps.cancelRequest("lp1");

        assertThat(f.book().getPendingLiquidityAdds()).isEqualByComparingTo("0");
        assertRejected(ErrorCode.NO_PENDING_REQUEST, () -> lps.cancelRequest("lp1"));
    }

    @Test
    void committedCollateralStaysInThePool() {
        f.commit("lp1", "60000", "100000");
        f.runCycle("100");

        assertRejected(ErrorCode.LIQUIDITY_COMMITTED, () -> lps.withdraw("lp1", dec("1")));
        assertRejected(ErrorCode.LIQUIDITY_COMMITTED, () -> lps.exitPool("lp1"));
        assertRejected(ErrorCode.INSUFFICIENT_COLLATERAL, () -> lps.reduceCollateral("lp1", dec("10000.01")));

        lps.reduceCollateral("lp1", dec("10000"));
        assertThat(f.reserve.balanceOf("lp1")).isEqualByComparingTo("10000");
        assertThat(lps.totalCollateral()).isEqualByComparingTo("50000");
    }

    @Test
    void uncommittedProviderCanWithdrawAndBeRemoved() {
        f.fund("lp1", "30000");
        lps.deposit("lp1", dec("20000"));
        lps.addCollateral("lp1", dec("10000"));

        lps.withdraw("lp1", dec("5000"));
        assertThat(f.reserve.balanceOf("lp1")).isEqualByComparingTo("5000");

        assertRejected(ErrorCode.NOT_AUTHORIZED, () -> lps.removeLP("lp2", "lp1"));
        assertThat(lps.removeLP(ADMIN, "lp1")).isEqualByComparingTo("25000");
        assertThat(lps.position("lp1")).isEmpty();
        assertThat(lps.totalCollateral()).isEqualByComparingTo("0");
        assertThat(f.reserve.balanceOf("lp1")).isEqualByComparingTo("30000");
    }

    @Test
    void unhealthyProviderLosesPartOfItsCommitmentToTheLiquidator() {
        f.commit("lp1", "50000", "100000");
        f.commit("lp2", "100000", "100000");
        f.fund("lp3", "100000");
        lps.deposit("lp3", dec("100000"));
        f.deposit("alice", "50000", "10000");
        f.runCycle("100");
        f.users().claimAsset("alice");
        assertThat(lps.health("lp1")).isEqualTo(HealthStatus.HEALTHY);
        assertRejected(ErrorCode.NOT_LIQUIDATABLE, () -> lps.liquidateLP("lp2", "lp1", dec("1000")));

        f.quote("1000", true);
        assertThat(lps.health("lp1")).isEqualTo(HealthStatus.LIQUIDATABLE);
        assertThat(lps.exposure(lps.position("lp1").orElseThrow())).isEqualByComparingTo("250000");

        assertRejected(ErrorCode.SELF_LIQUIDATION, () -> lps.liquidateLP("lp1", "lp1", dec("1000")));
        assertRejected(ErrorCode.EXCESSIVE_AMOUNT, () -> lps.liquidateLP("lp2", "lp1", dec("30001")));
        lps.liquidateLP("lp2", "lp1", dec("30000"));
        assertRejected(ErrorCode.INVALID_LIQUIDATION, () -> lps.liquidateLP("lp3", "lp1", dec("30000")));
        assertRejected(ErrorCode.EXCESSIVE_AMOUNT, () -> lps.reduceLiquidity("lp1", dec("80000")));

        f.openOffchain("1000");
        f.orchestrator().resolvePriceDeviation(ADMIN, false, 0, 0);
        f.openOnchain("1000");
        f.settleAll("1000");

        LiquidityPosition target = lps.position("lp1").orElseThrow();
        LiquidityPosition liquidator = lps.position("lp2").orElseThrow();
        assertThat(target.getLiquidityCommitment()).isEqualByComparingTo("70000");
        assertThat(target.getCollateralAmount()).isEqualByComparingTo("42500");
        assertThat(liquidator.getLiquidityCommitment()).isEqualByComparingTo("130000");
        assertThat(liquidator.getCollateralAmount()).isEqualByComparingTo("107500");
        assertThat(lps.sumOfCommitments()).isEqualByComparingTo(f.book().getTotalCommitted());
        assertThat(lps.totalCollateral()).isEqualByComparingTo("250000");
    }

    @Test
    void largerLiquidationTakesOverThePendingOne() {
        f.commit("lp1", "50000", "100000");
        f.commit("lp2", "100000", "100000");
        f.fund("lp3", "100000");
        lps.deposit("lp3", dec("100000"));
        f.deposit("alice", "50000", "10000");
        f.runCycle("100");
        f.users().claimAsset("alice");
        f.quote("1000", true);

        lps.liquidateLP("lp2", "lp1", dec("10000"));
        assertThat(lps.request("lp2").type()).isEqualTo(LiquidityRequestType.LIQUIDATE);

        lps.liquidateLP("lp3", "lp1", dec("20000"));
        assertThat(lps.request("lp2").isNone()).isTrue();
        assertThat(lps.request("lp3").type()).isEqualTo(LiquidityRequestType.LIQUIDATE);
        assertThat(lps.request("lp3").amount()).isEqualByComparingTo("20000");
        assertThat(lps.request("lp3").target()).isEqualTo("lp1");

        f.openOffchain("1000");
        f.orchestrator().resolvePriceDeviation(ADMIN, false, 0, 0);
        f.openOnchain("1000");
        f.settleAll("1000");

        assertThat(lps.position("lp1").orElseThrow().getLiquidityCommitment()).isEqualByComparingTo("80000");
        assertThat(lps.position("lp2").orElseThrow().getLiquidityCommitment()).isEqualByComparingTo("100000");
        assertThat(lps.position("lp3").orElseThrow().getLiquidityCommitment()).isEqualByComparingTo("20000");
        assertThat(lps.sumOfCommitments()).isEqualByComparingTo(f.book().getTotalCommitted());
        assertThat(lps.request("lp3").isNone()).isTrue();
    }
}
