package com.synthetic.cycleengine.infra.config;

import com.synthetic.cycleengine.domain.service.CycleTimings;
import com.synthetic.cycleengine.domain.service.PolicyParameters;
import com.synthetic.cycleengine.infra.token.TokenAccounting;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "protocol")
public class ProtocolProperties {

    private Cycle cycle = new Cycle();
    private Policy policy = new Policy();
    private Access access = new Access();
    private Reserve reserve = new Reserve();
    private Keeper keeper = new Keeper();
    private int commandBufferSize = 1024;
    private Duration commandTimeout = Duration.ofSeconds(30);
    private List<Pool> pools = new ArrayList<>();

    @Getter
    @Setter
    public static class Cycle {
        private Duration length = Duration.ofDays(1);
        private Duration rebalanceLength = Duration.ofHours(1);
        private Duration haltThreshold = Duration.ofHours(6);
        private long priceDeviationToleranceBps = 2_000;
        private long rebalancePriceToleranceBps = 100;

        public CycleTimings toTimings() {
            return new CycleTimings(length, rebalanceLength, haltThreshold,
                    priceDeviationToleranceBps, rebalancePriceToleranceBps);
        }
    }

    @Getter
    @Setter
    public static class Policy {
        private long baseRate = 600;
        private long rate1 = 1_200;
        private long maxRate = 3_000;
        private long tier1 = 6_500;
        private long tier2 = 8_500;
        private long userHealthyRatio = 2_000;
        private long userLiquidationThreshold = 1_250;
        private long lpHealthyRatio = 5_000;
        private long lpLiquidationThreshold = 3_000;
        private long lpLiquidationReward = 5_000;
        private long maxLiquidationShare = 3_000;
        private long protocolFee = 1_000;

        public PolicyParameters toParameters() {
            return new PolicyParameters(baseRate, rate1, maxRate, tier1, tier2,
                    userHealthyRatio, userLiquidationThreshold, lpHealthyRatio, lpLiquidationThreshold,
                    lpLiquidationReward, maxLiquidationShare, protocolFee);
        }
    }

    @Getter
    @Setter
    public static class Access {
        private List<String> admins = new ArrayList<>();
        private List<String> liquidityProviders = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Reserve {
        private String symbol = "USDC";
        private boolean faucetEnabled = true;
        private BigDecimal faucetLimit = new BigDecimal("1000000");
    }

    @Getter
    @Setter
    public static class Keeper {
        private boolean enabled = true;
        private long intervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Pool {
        private String symbol;
        private TokenAccounting.Scheme accounting = TokenAccounting.Scheme.SCALED_BALANCE;
        private BigDecimal referencePrice = BigDecimal.ONE;
    }
}
