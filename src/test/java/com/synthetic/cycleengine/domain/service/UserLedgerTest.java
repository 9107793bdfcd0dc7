package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.model.ClaimResult;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.UserPosition;
import com.synthetic.cycleengine.domain.model.UserRequest;
import com.synthetic.cycleengine.domain.model.UserRequestType;
import com.synthetic.cycleengine.infra.token.TokenAccounting;
import com.synthetic.cycleengine.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static com.synthetic.cycleengine.support.PoolFixture.ADMIN;
import static com.synthetic.cycleengine.support.PoolFixture.dec;
import static com.synthetic.cycleengine.support.ProtocolAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class UserLedgerTest {

    private PoolFixture f;
    private UserLedger users;

    @BeforeEach
    void setUp() {
        f = new PoolFixture();
        users = f.users();
        f.commit("lp1", "100000", "100000");
        f.fund("lp1", "50000");
    }

    @Nested
    class Deposits {

        @Test
        void cancelRefundsTheWholeEscrow() {
            f.fund("alice", "12000");

            users.depositRequest("alice", dec("10000"), dec("2000"));
            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("0");
            assertThat(f.reserve.balanceOf(f.custody())).isEqualByComparingTo("112000");
            assertThat(f.book().getPendingDeposits()).isEqualByComparingTo("10000");

            users.cancelRequest("alice");
            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("12000");
            assertThat(f.reserve.balanceOf(f.custody())).isEqualByComparingTo("100000");
            assertThat(f.book().getPendingDeposits()).isEqualByComparingTo("0");
            assertThat(f.book().pendingDepositEscrow()).isEqualByComparingTo("0");
            assertThat(users.request("alice")).isEqualTo(UserRequest.NONE);
        }

        @Test
        void requiresTwentyPercentCollateral() {
            f.fund("alice", "12000");

            assertRejected(ErrorCode.INSUFFICIENT_COLLATERAL,
                    () -> users.depositRequest("alice", dec("10000"), dec("1999.99")));
            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("12000");
        }

        @Test
        void requiresAvailableLiquidity() {
            f.fund("alice", "240000");

            assertRejected(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    () -> users.depositRequest("alice", dec("100000.01"), dec("40000")));
        }

        @Test
        void rejectsASecondRequestInTheSameCycle() {
            f.deposit("alice", "1000", "200");
            f.fund("alice", "1200");

            assertRejected(ErrorCode.REQUEST_PENDING,
                    () -> users.depositRequest("alice", dec("1000"), dec("200")));
        }

        @Test
        void rejectsZeroAmountAndBlankAccount() {
            assertRejected(ErrorCode.ZERO_AMOUNT, () -> users.depositRequest("alice", BigDecimal.ZERO, BigDecimal.ONE));
            assertRejected(ErrorCode.ZERO_ADDRESS, () -> users.depositRequest(" ", BigDecimal.ONE, BigDecimal.ONE));
        }

        @Test
        void rejectsDepositWithoutFunds() {
            assertRejected(ErrorCode.INSUFFICIENT_BALANCE,
                    () -> users.depositRequest("alice", dec("1000"), dec("200")));
        }

        @Test
        void cancelClosesWithTheActivePhase() {
            f.deposit("alice", "10000", "2000");
            f.openOffchain("100");

            assertRejected(ErrorCode.CANCEL_WINDOW_CLOSED, () -> users.cancelRequest("alice"));
        }

        @Test
        void depositsAreOnlyAcceptedWhileActive() {
            f.openOffchain("100");
            f.fund("alice", "12000");

            assertRejected(ErrorCode.INVALID_CYCLE_STATE,
                    () -> users.depositRequest("alice", dec("10000"), dec("2000")));
        }
    }

    @Nested
    class Claims {

        @Test
        void mintsAtTheCycleSettlementPrice() {
            f.deposit("alice", "10000", "2000");
            assertRejected(ErrorCode.REQUEST_NOT_SETTLED, () -> users.claimAsset("alice"));

            f.runCycle("100");
            ClaimResult result = users.claimAsset("alice");

            assertThat(result.type()).isEqualTo(UserRequestType.DEPOSIT);
            assertThat(result.cycle()).isEqualTo(1L);
            assertThat(result.assetAmount()).isEqualByComparingTo("100");
            assertThat(f.token.balanceOf("alice")).isEqualByComparingTo("100");
            assertThat(f.book().getTotalAssetShares()).isEqualByComparingTo("100");

            UserPosition position = users.position("alice").orElseThrow();
            assertThat(position.getAssetShares()).isEqualByComparingTo("100");
            assertThat(position.getCollateralAmount()).isEqualByComparingTo("2000");
            assertThat(position.getReserveAmount()).isEqualByComparingTo("10000");
            assertThat(position.getInterestIndex()).isEqualByComparingTo(f.book().interestIndexOf(1));
        }

        @Test
        void claimingTwiceFindsNothing() {
            f.deposit("alice", "10000", "2000");
            f.runCycle("100");
            users.claimAsset("alice");

            assertRejected(ErrorCode.NOTHING_TO_CLAIM, () -> users.claimAsset("alice"));
            assertRejected(ErrorCode.NOTHING_TO_CLAIM, () -> users.claimReserve("alice"));
            assertThat(f.token.balanceOf("alice")).isEqualByComparingTo("100");
        }
    }

    @Nested
    class Positions {

        @BeforeEach
        void mintForThreeUsers() {
            f.deposit("alice", "10000", "2000");
            f.deposit("bob", "10000", "2000");
            f.deposit("carol", "10000", "2000");
            f.runCycle("100");
            users.claimAsset("alice");
            users.claimAsset("bob");
            users.claimAsset("carol");
        }

        @Test
        void healthyPositionCannotBeLiquidated() {
            assertThat(users.health("alice")).isEqualTo(HealthStatus.HEALTHY);
            assertRejected(ErrorCode.NOT_LIQUIDATABLE,
                    () -> users.liquidationRequest("bob", "alice", dec("10")));
        }

        @Test
        void selfLiquidationIsRejected() {
            f.quote("200", true);

            assertRejected(ErrorCode.SELF_LIQUIDATION,
                    () -> users.liquidationRequest("alice", "alice", dec("10")));
        }

        @Test
        void liquidationIsCappedAndOnlyReplacedByALargerRequest() {
            f.quote("200", true);
            assertThat(users.health("alice")).isEqualTo(HealthStatus.LIQUIDATABLE);

            assertRejected(ErrorCode.EXCESSIVE_AMOUNT,
                    () -> users.liquidationRequest("bob", "alice", dec("31")));

            users.liquidationRequest("bob", "alice", dec("10"));
            assertThat(f.token.balanceOf("bob")).isEqualByComparingTo("90");

            assertRejected(ErrorCode.INVALID_LIQUIDATION,
                    () -> users.liquidationRequest("carol", "alice", dec("10")));

            users.liquidationRequest("carol", "alice", dec("20"));
            assertThat(f.token.balanceOf("bob")).isEqualByComparingTo("100");
            assertThat(f.token.balanceOf("carol")).isEqualByComparingTo("80");
            assertThat(users.request("bob").isNone()).isTrue();
            assertThat(users.request("carol").type()).isEqualTo(UserRequestType.LIQUIDATE);
            assertThat(f.book().getPendingRedemptionShares()).isEqualByComparingTo("20");
        }

        @Test
        void liquidatorIsPaidFromTheTargetPosition() {
            f.quote("200", true);
            users.liquidationRequest("carol", "alice", dec("20"));

            f.openOffchain("200");
            f.orchestrator().resolvePriceDeviation(ADMIN, false, 0, 0);
            f.openOnchain("200");
            f.settleAll("200");

            BigDecimal indexDelta = f.book().interestIndexOf(2).subtract(f.book().interestIndexOf(1));
            BigDecimal interest = Decimals.up(dec("20").multiply(indexDelta).multiply(dec("200")));
            BigDecimal expected = dec("4000").subtract(interest).add(dec("400"));

            ClaimResult result = users.claimReserve("carol");
            assertThat(result.type()).isEqualTo(UserRequestType.LIQUIDATE);
            assertThat(result.interestCharged()).isEqualByComparingTo(interest);
            assertThat(result.reservePaid()).isEqualByComparingTo(expected);
            assertThat(f.reserve.balanceOf("carol")).isEqualByComparingTo(expected);

            UserPosition alice = users.position("alice").orElseThrow();
            assertThat(alice.getAssetShares()).isEqualByComparingTo("80");
            assertThat(alice.getCollateralAmount()).isEqualByComparingTo("1600");
            assertThat(f.book().getTotalAssetShares()).isEqualByComparingTo("280");
        }

        @Test
        void collateralCannotDropBelowTheHealthyRatio() {
            assertRejected(ErrorCode.INSUFFICIENT_COLLATERAL, () -> users.reduceCollateral("alice", dec("1")));

            f.fund("alice", "500");
            users.addCollateral("alice", dec("500"));
            users.reduceCollateral("alice", dec("500"));

            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("500");
            assertThat(users.position("alice").orElseThrow().getCollateralAmount()).isEqualByComparingTo("2000");
        }

        @Test
        void collateralCanBeReducedOnceTheRequestIsSettled() {
            f.fund("alice", "500");
            users.addCollateral("alice", dec("500"));
            users.redemptionRequest("alice", dec("10"));
            assertRejected(ErrorCode.REQUEST_PENDING, () -> users.reduceCollateral("alice", dec("400")));

            f.runCycle("100");
            users.reduceCollateral("alice", dec("400"));

            assertThat(f.reserve.balanceOf("alice")).isEqualByComparingTo("400");
            assertThat(users.position("alice").orElseThrow().getCollateralAmount()).isEqualByComparingTo("2100");
            assertThat(users.request("alice").type()).isEqualTo(UserRequestType.REDEEM);
        }

        @Test
        void cancelledRedemptionReturnsTheExactEscrowAfterAReverseSplit() {
            f.openOffchain("100");
            f.clock.advance(Duration.ofHours(1));
            f.quote("300", false);
            f.orchestrator().resolvePriceDeviation(ADMIN, true, 1, 3);
            f.orchestrator().initiateOnchainRebalance();
            f.settleAll("300");
            BigDecimal before = f.token.balanceOf("alice");
            assertThat(before).isEqualByComparingTo("33.3333333333333333");

            users.redemptionRequest("alice", dec("1"));
            assertThat(users.request("alice").escrow()).isEqualByComparingTo("1");
            users.cancelRequest("alice");

            assertThat(f.token.balanceOf("alice")).isEqualByComparingTo(before);
            assertThat(f.token.balanceOf(f.custody())).isEqualByComparingTo("0");
            assertThat(f.book().getPendingRedemptionShares()).isEqualByComparingTo("0");
        }

        @Test
        void redemptionCannotExceedThePosition() {
            f.token.mint("alice", dec("5"));

            assertRejected(ErrorCode.INSUFFICIENT_POSITION, () -> users.redemptionRequest("alice", dec("105")));
        }

        @Test
        void exitRequiresAHaltedPool() {
            assertRejected(ErrorCode.POOL_NOT_HALTED, () -> users.exitPool("alice", dec("10")));
        }
    }

    @Test
    void weightedIndexAveragesByShares() {
        assertThat(UserLedger.weightedIndex(dec("100"), dec("1.0"), dec("100"), dec("1.1")))
                .isEqualByComparingTo("1.05");
        assertThat(UserLedger.weightedIndex(BigDecimal.ZERO, dec("1.0"), dec("5"), dec("1.2")))
                .isEqualByComparingTo("1.2");
    }

    @Test
    void toppedUpPositionIsChargedFromTheWeightedIndex() {
        f.deposit("alice", "10000", "2000");
        f.runCycle("100");
        users.claimAsset("alice");
        f.deposit("alice", "10000", "2000");
        f.runCycle("100");
        users.claimAsset("alice");

        BigDecimal first = f.book().interestIndexOf(1);
        BigDecimal second = f.book().interestIndexOf(2);
        BigDecimal weighted = Decimals.divDown(dec("100").multiply(first).add(dec("100").multiply(second)), dec("200"));
        UserPosition position = users.position("alice").orElseThrow();
        assertThat(second).isGreaterThan(first);
        assertThat(position.getAssetShares()).isEqualByComparingTo("200");
        assertThat(position.getInterestIndex()).isEqualByComparingTo(weighted);

        users.redemptionRequest("alice", dec("200"));
        f.runCycle("100");
        ClaimResult result = users.claimReserve("alice");

        BigDecimal third = f.book().interestIndexOf(3);
        BigDecimal interest = Decimals.up(dec("200").multiply(third.subtract(weighted)).multiply(dec("100")));
        assertThat(result.interestCharged()).isEqualByComparingTo(interest);
        assertThat(result.reservePaid()).isEqualByComparingTo(dec("24000").subtract(interest));
        assertThat(users.position("alice")).isEmpty();
    }

    @Test
    void priceScaledTokenSettlesLikeAnyOther() {
        PoolFixture scaled = new PoolFixture(new TokenAccounting.PriceScaled(dec("200")));
        scaled.commit("lp1", "100000", "100000");
        scaled.fund("lp1", "50000");
        scaled.deposit("alice", "10000", "2000");
        scaled.runCycle("100");

        assertThat(scaled.users().claimAsset("alice").assetAmount()).isEqualByComparingTo("100");
        assertThat(scaled.token.balanceOf("alice")).isEqualByComparingTo("100");

        scaled.users().redemptionRequest("alice", dec("40"));
        scaled.runCycle("100");
        ClaimResult result = scaled.users().claimReserve("alice");

        assertThat(result.assetAmount()).isEqualByComparingTo("40");
        assertThat(result.interestCharged()).isPositive();
        assertThat(result.reservePaid()).isEqualByComparingTo(dec("4800").subtract(result.interestCharged()));
        assertThat(scaled.token.balanceOf("alice")).isEqualByComparingTo("60");
        assertThat(scaled.token.totalSupply()).isEqualByComparingTo("60");
        assertThat(scaled.users().assetAmount("alice")).isEqualByComparingTo("60");
    }
}
