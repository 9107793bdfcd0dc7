package com.synthetic.cycleengine.infra.config;

import com.synthetic.cycleengine.domain.external.CapabilityService;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolFactory;
import com.synthetic.cycleengine.domain.service.AssetPoolRegistry;
import com.synthetic.cycleengine.domain.service.CycleEventListener;
import com.synthetic.cycleengine.domain.service.DefaultProtocolPolicy;
import com.synthetic.cycleengine.domain.service.ProtocolPolicy;
import com.synthetic.cycleengine.infra.oracle.FeedAssetOracle;
import com.synthetic.cycleengine.infra.oracle.OracleFeeds;
import com.synthetic.cycleengine.infra.security.ConfiguredCapabilityService;
import com.synthetic.cycleengine.infra.token.AccountingSyntheticToken;
import com.synthetic.cycleengine.infra.token.InMemoryReserveToken;
import com.synthetic.cycleengine.infra.token.TokenAccounting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Builds the shared collaborators and one pool per configured asset.
 */
@Slf4j
@Configuration
public class ProtocolConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock protocolClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProtocolPolicy protocolPolicy(ProtocolProperties properties) {
        return new DefaultProtocolPolicy(properties.getPolicy().toParameters());
    }

    @Bean
    public ConfiguredCapabilityService capabilityService(ProtocolProperties properties) {
        return new ConfiguredCapabilityService(properties.getAccess().getAdmins(),
                properties.getAccess().getLiquidityProviders());
    }

    @Bean
    public InMemoryReserveToken reserveToken(ProtocolProperties properties) {
        return new InMemoryReserveToken(properties.getReserve().getSymbol());
    }

    @Bean
    public OracleFeeds oracleFeeds() {
        return new OracleFeeds();
    }

    @Bean
    public AssetPoolFactory assetPoolFactory(ProtocolPolicy policy, CapabilityService capabilityService,
                                             ReserveToken reserveToken, ProtocolProperties properties, Clock clock) {
        return new AssetPoolFactory(policy, capabilityService, reserveToken, properties.getCycle().toTimings(), clock);
    }

    @Bean
    public AssetPoolRegistry assetPoolRegistry(AssetPoolFactory factory, OracleFeeds oracleFeeds,
                                               ProtocolProperties properties, List<CycleEventListener> listeners) {
        AssetPoolRegistry registry = new AssetPoolRegistry();
        for (ProtocolProperties.Pool pool : properties.getPools()) {
            FeedAssetOracle oracle = oracleFeeds.create(pool.getSymbol());
            TokenAccounting accounting = TokenAccounting.of(pool.getAccounting(), pool.getReferencePrice());
            AccountingSyntheticToken token = new AccountingSyntheticToken("s" + pool.getSymbol().toUpperCase(), accounting);
            AssetPool created = factory.create(pool.getSymbol(), oracle, token, listeners);
            registry.register(created);
        }
        log.info("[Config] {} pool(s) registered: {}", registry.all().size(),
                registry.all().stream().map(AssetPool::symbol).toList());
        return registry;
    }
}
