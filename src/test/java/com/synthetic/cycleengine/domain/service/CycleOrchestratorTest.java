package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.model.ClaimResult;
import com.synthetic.cycleengine.domain.model.CycleSnapshot;
import com.synthetic.cycleengine.domain.model.CycleState;
import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.model.SettlementResult;
import com.synthetic.cycleengine.infra.token.TokenAccounting;
import com.synthetic.cycleengine.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.synthetic.cycleengine.support.PoolFixture.ADMIN;
import static com.synthetic.cycleengine.support.PoolFixture.dec;
import static com.synthetic.cycleengine.support.ProtocolAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class CycleOrchestratorTest {

    private PoolFixture f;
    private CycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        f = new PoolFixture();
        orchestrator = f.orchestrator();
    }

    private CycleSnapshot lastSnapshot() {
        List<CycleSnapshot> history = f.book().getHistory();
        return history.get(history.size() - 1);
    }

    @Nested
    class Transitions {

        @Test
        void indexGrowsSixPercentOverAYearAtZeroUtilization() {
            assertThat(orchestrator.nextIndex(PoolFixture.GENESIS.plus(Duration.ofDays(365))))
                    .isEqualByComparingTo("1.06");

            f.clock.advance(Duration.ofDays(365));
            f.quote("100", true);
            orchestrator.initiateOffchainRebalance();

            assertThat(f.book().getCurrentIndex()).isEqualByComparingTo("1.06");
            assertThat(f.book().interestIndexOf(1)).isEqualByComparingTo("1.06");
        }

        @Test
        void offchainWaitsForTheCycleLengthAndAnOpenMarket() {
            f.clock.advance(Duration.ofHours(23));
            f.quote("100", true);
            assertThat(orchestrator.isTransitionDue()).isFalse();
            assertRejected(ErrorCode.CYCLE_IN_PROGRESS, orchestrator::initiateOffchainRebalance);

            f.clock.advance(Duration.ofHours(1));
            f.quote("100", false);
            assertThat(orchestrator.isTransitionDue()).isTrue();
            assertRejected(ErrorCode.MARKET_CLOSED, orchestrator::initiateOffchainRebalance);
            assertThat(f.book().getState()).isEqualTo(CycleState.ACTIVE);
        }

        @Test
        void onchainWaitsForTheWindowAClosedMarketAndAFreshPrice() {
            f.openOffchain("100");
            assertRejected(ErrorCode.REBALANCE_IN_PROGRESS, orchestrator::initiateOnchainRebalance);

            f.clock.advance(Duration.ofHours(1));
            assertRejected(ErrorCode.MARKET_OPEN, orchestrator::initiateOnchainRebalance);

            f.oracle.setMarketOpen(false);
            assertRejected(ErrorCode.ORACLE_NOT_UPDATED, orchestrator::initiateOnchainRebalance);

            f.quote("100", false);
            orchestrator.initiateOnchainRebalance();
            assertThat(f.book().getCurrentCycle()).isEqualTo(2L);
        }

        @Test
        void cycleWithoutCommittedLiquidityClosesAtTheOnchainTransition() {
            f.runCycle("100");

            assertThat(f.transitions).extracting(CycleTransition::to).containsExactly(
                    CycleState.REBALANCING_OFFCHAIN, CycleState.REBALANCING_ONCHAIN, CycleState.ACTIVE);
            CycleTransition closed = f.transitions.get(2);
            assertThat(closed.cycle()).isEqualTo(1L);
            assertThat(closed.snapshot()).isNotNull();
            assertThat(closed.snapshot().settlementPrice()).isEqualByComparingTo("100");
            assertThat(f.book().getCurrentCycle()).isEqualTo(2L);
            assertThat(f.book().getLastSettlementPrice()).isEqualByComparingTo("100");
        }

        @Test
        void failingListenerDoesNotBlockTheCycle() {
            orchestrator.addListener(t -> {
                throw new IllegalStateException("listener down");
            });

            f.runCycle("100");

            assertThat(f.book().getCurrentCycle()).isEqualTo(2L);
            assertThat(f.transitions).hasSize(3);
        }
    }

    @Nested
    class Settlement {

        @BeforeEach
        void commitTwoProviders() {
            f.commit("lp1", "100000", "100000");
            f.commit("lp2", "50000", "50000");
            f.runCycle("100");
            assertThat(f.book().getTotalCommitted()).isEqualByComparingTo("150000");
        }

        @Test
        void netFlowIsSplitProRataAndTheLastProviderTakesTheRemainder() {
            f.deposit("alice", "10000", "2000");
            f.openOffchain("100");
            f.openOnchain("100");
            assertThat(orchestrator.unsettledLiquidityProviders()).containsExactlyInAnyOrder("lp1", "lp2");

            SettlementResult first = orchestrator.rebalancePool("lp1", dec("100"));
            assertThat(first.netAmount()).isEqualByComparingTo("6666.666666666666666666");
            assertThat(first.cycleClosed()).isFalse();
            assertRejected(ErrorCode.ALREADY_REBALANCED, () -> orchestrator.rebalancePool("lp1", dec("100")));

            SettlementResult last = orchestrator.rebalancePool("lp2", dec("100"));
            assertThat(last.netAmount()).isEqualByComparingTo("3333.333333333333333334");
            assertThat(last.cycleClosed()).isTrue();

            assertThat(f.reserve.balanceOf("lp1").add(f.reserve.balanceOf("lp2"))).isEqualByComparingTo("10000");
            assertThat(f.book().getCurrentCycle()).isEqualTo(3L);
            assertThat(f.book().getState()).isEqualTo(CycleState.ACTIVE);
            assertThat(lastSnapshot().netFlow()).isEqualByComparingTo("10000");
            assertThat(lastSnapshot().depositTotal()).isEqualByComparingTo("10000");
            assertThat(f.lps().position("lp1").orElseThrow().getLastRebalanceCycle()).isEqualTo(2L);
        }

        @Test
        void settlementPriceAndAmountAreChecked() {
            f.deposit("alice", "10000", "2000");
            f.openOffchain("100");
            f.openOnchain("100");

            assertRejected(ErrorCode.NOT_ACTIVE_LP, () -> orchestrator.rebalancePool("lp3", dec("100")));
            assertRejected(ErrorCode.PRICE_NOT_IN_RANGE, () -> orchestrator.rebalancePool("lp1", dec("101.01")));
            assertRejected(ErrorCode.REBALANCE_MISMATCH,
                    () -> orchestrator.rebalancePool("lp1", dec("100"), dec("6666.67"), false));
            assertRejected(ErrorCode.REBALANCE_MISMATCH,
                    () -> orchestrator.rebalancePool("lp1", dec("100"), dec("6666.666666666666666666"), true));

            SettlementResult result = orchestrator.rebalancePool("lp1", dec("101"),
                    dec("6666.666666666666666666"), false);
            assertThat(result.netAmount()).isEqualByComparingTo("6666.666666666666666666");
            assertThat(orchestrator.unsettledLiquidityProviders()).containsExactly("lp2");
        }

        @Test
        void rebalancingOutsideTheOnchainPhaseIsRejected() {
            assertRejected(ErrorCode.INVALID_CYCLE_STATE, () -> orchestrator.rebalancePool("lp1", dec("100")));
        }

        @Test
        void commitmentsStayConsistentWithThePoolTotal() {
            f.lps().reduceLiquidity("lp2", dec("20000"));
            f.runCycle("100");

            assertThat(f.lps().sumOfCommitments()).isEqualByComparingTo(f.book().getTotalCommitted());
            assertThat(f.book().getTotalCommitted()).isEqualByComparingTo("130000");
        }
    }

    @Nested
    class Interest {

        @BeforeEach
        void mintForAlice() {
            f.commit("lp1", "100000", "100000");
            f.fund("lp1", "50000");
            f.deposit("alice", "10000", "2000");
            f.runCycle("100");
            f.users().claimAsset("alice");
        }

        @Test
        void redemptionPaysInterestToTheProviderAndTheProtocol() {
            f.users().redemptionRequest("alice", dec("40"));
            f.runCycle("100");

            CycleSnapshot snapshot = lastSnapshot();
            BigDecimal collected = snapshot.interestCollected();
            assertThat(collected).isPositive();
            assertThat(snapshot.redemptionValue()).isEqualByComparingTo("4000");

            BigDecimal fee = Decimals.applyBps(collected, 1_000);
            BigDecimal credited = f.lps().position("lp1").orElseThrow().getInterestAccrued();
            assertThat(f.book().getProtocolFeeAccrued()).isEqualByComparingTo(fee);
            assertThat(credited.add(fee)).isEqualByComparingTo(collected);

            BigDecimal indexDelta = f.book().interestIndexOf(2).subtract(f.book().interestIndexOf(1));
            BigDecimal charged = Decimals.up(dec("40").multiply(indexDelta).multiply(dec("100")));
            ClaimResult claim = f.users().claimReserve("alice");
            assertThat(claim.interestCharged()).isEqualByComparingTo(charged);
            assertThat(claim.reservePaid()).isEqualByComparingTo(dec("4800").subtract(charged));
            assertThat(f.book().getClaimLiability()).isEqualByComparingTo("0");
            assertThat(f.users().position("alice").orElseThrow().getAssetShares()).isEqualByComparingTo("60");
            assertThat(f.token.totalSupply()).isEqualByComparingTo("60");

            assertThat(f.lps().claimInterest("lp1")).isEqualByComparingTo(credited);
            assertRejected(ErrorCode.NOTHING_TO_CLAIM, () -> f.lps().claimInterest("lp1"));
        }

        @Test
        void protocolFeeIsCollectedByAnAdminOnce() {
            f.users().redemptionRequest("alice", dec("40"));
            f.runCycle("100");
            BigDecimal fee = f.book().getProtocolFeeAccrued();

            assertRejected(ErrorCode.NOT_AUTHORIZED, () -> orchestrator.collectProtocolFee("alice", "treasury"));
            assertThat(orchestrator.collectProtocolFee(ADMIN, "treasury")).isEqualByComparingTo(fee);
            assertThat(f.reserve.balanceOf("treasury")).isEqualByComparingTo(fee);
            assertRejected(ErrorCode.NOTHING_TO_CLAIM, () -> orchestrator.collectProtocolFee(ADMIN, "treasury"));
        }

        @Test
        void forcedSettlementIsChargedToCollateralWhenItCovers() {
            f.users().redemptionRequest("alice", dec("40"));
            f.openOffchain("100");
            f.openOnchain("100");
            f.reserve.transfer("lp1", "elsewhere", dec("50000"));

            assertRejected(ErrorCode.INSUFFICIENT_BALANCE, () -> orchestrator.rebalancePool("lp1", dec("100")));
            assertRejected(ErrorCode.HALT_THRESHOLD_NOT_REACHED, () -> orchestrator.forceRebalanceLP(ADMIN, "lp1"));

            f.clock.advance(Duration.ofHours(6));
            assertRejected(ErrorCode.NOT_AUTHORIZED, () -> orchestrator.forceRebalanceLP("lp1", "lp1"));
            SettlementResult result = orchestrator.forceRebalanceLP(ADMIN, "lp1");

            assertThat(result.forced()).isTrue();
            assertThat(result.halted()).isFalse();
            assertThat(result.cycleClosed()).isTrue();
            assertThat(result.netAmount()).isEqualByComparingTo("-4000");
            assertThat(f.lps().position("lp1").orElseThrow().getCollateralAmount()).isEqualByComparingTo("96000");
            assertThat(f.book().getState()).isEqualTo(CycleState.ACTIVE);
        }
    }

    @Nested
    class Splits {

        @BeforeEach
        void mintForAlice() {
            f.commit("lp1", "100000", "100000");
            f.deposit("alice", "10000", "2000");
            f.runCycle("100");
            f.users().claimAsset("alice");
        }

        @Test
        void priceDeviationMustBeResolvedBeforeSettlement() {
            f.openOffchain("100");
            f.clock.advance(Duration.ofHours(1));
            f.quote("70", false);

            assertRejected(ErrorCode.PRICE_DEVIATION_HIGH, orchestrator::initiateOnchainRebalance);
            assertRejected(ErrorCode.NOT_AUTHORIZED,
                    () -> orchestrator.resolvePriceDeviation("alice", false, 0, 0));

            orchestrator.resolvePriceDeviation(ADMIN, false, 0, 0);
            assertRejected(ErrorCode.DEVIATION_ALREADY_RESOLVED,
                    () -> orchestrator.resolvePriceDeviation(ADMIN, false, 0, 0));
            orchestrator.initiateOnchainRebalance();
            assertThat(f.book().getSettlementPrice()).isEqualByComparingTo("70");
        }

        @Test
        void confirmedSplitRescalesBalancesAndPreservesValue() {
            f.deposit("bob", "10000", "2000");
            f.openOffchain("100");
            f.clock.advance(Duration.ofHours(1));
            f.quote("50", false);
            assertThat(f.oracle.splitDetected()).isTrue();

            assertRejected(ErrorCode.PRICE_DEVIATION_HIGH, orchestrator::initiateOnchainRebalance);
            assertRejected(ErrorCode.INVALID_SPLIT, () -> orchestrator.resolvePriceDeviation(ADMIN, true, 3, 1));

            orchestrator.resolvePriceDeviation(ADMIN, true, 2, 1);
            assertThat(f.token.splitMultiplier()).isEqualByComparingTo("2");
            assertThat(f.token.balanceOf("alice")).isEqualByComparingTo("200");
            assertThat(f.users().assetAmount("alice")).isEqualByComparingTo("200");

            orchestrator.initiateOnchainRebalance();
            f.settleAll("50");
            assertThat(f.book().splitMultiplierOf(2)).isEqualByComparingTo("2");
            assertThat(f.book().splitMultiplierOf(1)).isEqualByComparingTo("1");

            assertThat(f.users().claimAsset("bob").assetAmount()).isEqualByComparingTo("200");
            assertThat(f.token.balanceOf("alice").multiply(f.oracle.currentPrice())).isEqualByComparingTo("10000");
            assertThat(f.book().getTotalAssetShares()).isEqualByComparingTo("200");
        }
    }

    @Test
    void detectedSplitBlocksSettlementEvenInsideTheDeviationBand() {
        PoolFixture wide = new PoolFixture(new TokenAccounting.ScaledBalance(), 6_000);
        wide.commit("lp1", "100000", "100000");
        wide.deposit("alice", "10000", "2000");
        wide.runCycle("100");
        wide.users().claimAsset("alice");

        wide.openOffchain("100");
        wide.clock.advance(Duration.ofHours(1));
        wide.quote("50", false);
        assertThat(wide.oracle.splitDetected()).isTrue();
        assertRejected(ErrorCode.PRICE_DEVIATION_HIGH, wide.orchestrator()::initiateOnchainRebalance);
        assertThat(wide.token.balanceOf("alice")).isEqualByComparingTo("100");

        wide.orchestrator().resolvePriceDeviation(ADMIN, true, 2, 1);
        wide.orchestrator().initiateOnchainRebalance();
        wide.settleAll("50");
        assertThat(wide.book().splitMultiplierOf(2)).isEqualByComparingTo("2");
        assertThat(wide.users().assetAmount("alice")).isEqualByComparingTo("200");

        wide.runCycle("50");
        assertThat(wide.oracle.splitDetected()).isTrue();
        assertThat(wide.book().getCurrentCycle()).isEqualTo(4L);
    }

    @Nested
    class HaltedExit {

        @BeforeEach
        void haltWithTwoHolders() {
            f.commit("lp1", "50000", "100000");
            f.deposit("alice", "10000", "12000");
            f.deposit("bob", "10000", "2000");
            f.runCycle("100");
            f.users().claimAsset("alice");
            f.users().claimAsset("bob");

            f.users().redemptionRequest("bob", dec("100"));
            f.openOffchain("1000");
            orchestrator.resolvePriceDeviation(ADMIN, false, 0, 0);
            f.openOnchain("1000");
            f.clock.advance(Duration.ofHours(6));
            orchestrator.forceRebalanceLP(ADMIN, "lp1");
            f.users().cancelRequest("bob");
        }

        @Test
        void eachHolderKeepsTheirOwnCollateral() {
            assertThat(f.book().getState()).isEqualTo(CycleState.HALTED);
            assertThat(f.reserve.balanceOf(f.custody())).isEqualByComparingTo("84000");
            assertThat(f.users().haltedUserReserve()).isEqualByComparingTo("70000");

            BigDecimal alice = f.users().exitPool("alice", dec("100"));
            BigDecimal bob = f.users().exitPool("bob", dec("100"));

            assertThat(alice).isEqualByComparingTo("47000");
            assertThat(bob).isEqualByComparingTo("37000");
            assertThat(alice.subtract(bob)).isEqualByComparingTo("10000");
            assertThat(f.users().position("alice")).isEmpty();
            assertThat(f.reserve.balanceOf(f.custody())).isEqualByComparingTo("0");
        }

        @Test
        void holderWithoutAPositionOnlySharesThePool() {
            f.token.transfer("bob", "carol", dec("50"));

            assertThat(f.users().exitPool("carol", dec("50"))).isEqualByComparingTo("17500");
            assertThat(f.users().exitPool("bob", dec("50"))).isEqualByComparingTo("18500");
        }
    }

    @Nested
    class Halt {

        @BeforeEach
        void underCollateralizedProvider() {
            f.commit("lp1", "50000", "100000");
            f.fund("lp2", "5000");
            f.lps().deposit("lp2", dec("5000"));
            f.deposit("alice", "10000", "2000");
            f.runCycle("100");
            f.users().claimAsset("alice");

            f.users().redemptionRequest("alice", dec("100"));
            f.openOffchain("1000");
            orchestrator.resolvePriceDeviation(ADMIN, false, 0, 0);
            f.openOnchain("1000");
        }

        @Test
        void uncoveredObligationHaltsThePool() {
            assertRejected(ErrorCode.INSUFFICIENT_BALANCE, () -> orchestrator.rebalancePool("lp1", dec("1000")));
            f.clock.advance(Duration.ofHours(6));
            assertRejected(ErrorCode.NOT_ACTIVE_LP, () -> orchestrator.forceRebalanceLP(ADMIN, "lp2"));

            SettlementResult result = orchestrator.forceRebalanceLP(ADMIN, "lp1");

            assertThat(result.halted()).isTrue();
            assertThat(result.netAmount()).isEqualByComparingTo("-100000");
            assertThat(f.book().getState()).isEqualTo(CycleState.HALTED);
            assertThat(lastSnapshot().outcome()).isEqualTo(CycleState.HALTED);
            assertThat(f.transitions.get(f.transitions.size() - 1).to()).isEqualTo(CycleState.HALTED);
            assertThat(f.lps().position("lp1").orElseThrow().getCollateralAmount()).isEqualByComparingTo("0");
            assertThat(orchestrator.unsettledLiquidityProviders()).isEmpty();
        }

        @Test
        void haltedPoolOnlyAllowsExits() {
            f.clock.advance(Duration.ofHours(6));
            orchestrator.forceRebalanceLP(ADMIN, "lp1");

            f.fund("bob", "12000");
            assertRejected(ErrorCode.POOL_HALTED,
                    () -> f.users().depositRequest("bob", dec("10000"), dec("2000")));
            f.fund("lp2", "1000");
            assertRejected(ErrorCode.POOL_HALTED, () -> f.lps().deposit("lp2", dec("1000")));
            assertRejected(ErrorCode.POOL_HALTED, orchestrator::initiateOffchainRebalance);

            f.users().cancelRequest("alice");
            assertThat(f.token.balanceOf("alice")).isEqualByComparingTo("100");
            assertThat(f.users().haltedUserReserve()).isEqualByComparingTo("60000");

            assertThat(f.users().exitPool("alice", dec("100"))).isEqualByComparingTo("62000");
            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("62000");
            assertThat(f.token.totalSupply()).isEqualByComparingTo("0");

            assertThat(f.lps().exitPool("lp2")).isEqualByComparingTo("5000");
            assertThat(f.lps().exitPool("lp1")).isEqualByComparingTo("0");
            assertThat(f.reserve.balanceOf(f.custody())).isEqualByComparingTo("0");
        }
    }
}
