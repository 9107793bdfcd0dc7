package com.synthetic.cycleengine.support;

import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.model.OracleQuote;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolFactory;
import com.synthetic.cycleengine.domain.service.CycleBook;
import com.synthetic.cycleengine.domain.service.CycleEventListener;
import com.synthetic.cycleengine.domain.service.CycleOrchestrator;
import com.synthetic.cycleengine.domain.service.CycleTimings;
import com.synthetic.cycleengine.domain.service.DefaultProtocolPolicy;
import com.synthetic.cycleengine.domain.service.LiquidityProviderLedger;
import com.synthetic.cycleengine.domain.service.PolicyParameters;
import com.synthetic.cycleengine.domain.service.UserLedger;
import com.synthetic.cycleengine.infra.oracle.FeedAssetOracle;
import com.synthetic.cycleengine.infra.security.ConfiguredCapabilityService;
import com.synthetic.cycleengine.infra.token.AccountingSyntheticToken;
import com.synthetic.cycleengine.infra.token.InMemoryReserveToken;
import com.synthetic.cycleengine.infra.token.TokenAccounting;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One TSLA pool wired with in-memory collaborators and a manual clock.
 * Accounts {@code lp1..lp3} are allow-listed LPs, {@code admin} is the admin.
 */
public class PoolFixture {

    public static final Instant GENESIS = Instant.parse("2024-01-01T00:00:00Z");
    public static final String ADMIN = "admin";

    public final MutableClock clock = new MutableClock(GENESIS);
    public final InMemoryReserveToken reserve = new InMemoryReserveToken("USDC");
    public final ConfiguredCapabilityService capabilities =
            new ConfiguredCapabilityService(List.of(ADMIN), List.of("lp1", "lp2", "lp3"));
    public final DefaultProtocolPolicy policy = new DefaultProtocolPolicy(PolicyParameters.defaults());
    public final CycleTimings timings;
    public final FeedAssetOracle oracle = new FeedAssetOracle("TSLA");
    public final AccountingSyntheticToken token;
    public final List<CycleTransition> transitions = new ArrayList<>();
    public final AssetPool pool;

    public PoolFixture() {
        this(new TokenAccounting.ScaledBalance());
    }

    public PoolFixture(TokenAccounting accounting) {
        this(accounting, 2_000);
    }

    public PoolFixture(TokenAccounting accounting, long priceDeviationToleranceBps) {
        this.timings = new CycleTimings(Duration.ofDays(1), Duration.ofHours(1), Duration.ofHours(6),
                priceDeviationToleranceBps, 100);
        this.token = new AccountingSyntheticToken("sTSLA", accounting);
        AssetPoolFactory factory = new AssetPoolFactory(policy, capabilities, reserve, timings, clock);
        this.pool = factory.create("TSLA", oracle, token, List.<CycleEventListener>of(transitions::add));
    }

    public UserLedger users() {
        return pool.users();
    }

    public LiquidityProviderLedger lps() {
        return pool.liquidity();
    }

    public CycleOrchestrator orchestrator() {
        return pool.orchestrator();
    }

    public CycleBook book() {
        return pool.book();
    }

    public String custody() {
        return pool.custody();
    }

    public void fund(String account, String amount) {
        reserve.mint(account, dec(amount));
    }

    public void quote(String close, boolean marketOpen) {
        BigDecimal price = dec(close);
        oracle.update(new OracleQuote(price, price, price, price, clock.instant()), marketOpen, clock.instant());
    }

    /** Funds, registers and requests a commitment; it becomes active when the cycle closes. */
    public void commit(String lp, String collateral, String liquidity) {
        fund(lp, collateral);
        lps().deposit(lp, dec(collateral));
        lps().addLiquidity(lp, dec(liquidity));
    }

    public void deposit(String user, String amount, String collateral) {
        fund(user, dec(amount).add(dec(collateral)).toPlainString());
        users().depositRequest(user, dec(amount), dec(collateral));
    }

    public void openOffchain(String price) {
        clock.advance(timings.cycleLength());
        quote(price, true);
        orchestrator().initiateOffchainRebalance();
    }

    public void openOnchain(String price) {
        clock.advance(timings.rebalanceLength());
        quote(price, false);
        orchestrator().initiateOnchainRebalance();
    }

    /** Runs a full cycle at one price; every active LP settles in name order. */
    public void runCycle(String price) {
        openOffchain(price);
        openOnchain(price);
        settleAll(price);
    }

    public void settleAll(String price) {
        List<String> pending = new ArrayList<>(orchestrator().unsettledLiquidityProviders());
        pending.sort(String::compareTo);
        for (String lp : pending) {
            orchestrator().rebalancePool(lp, dec(price));
        }
    }

    public static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }
}
