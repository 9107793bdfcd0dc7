package com.synthetic.cycleengine.infra.oracle;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushable oracle feeds by asset symbol.
 */
public class OracleFeeds {

    private final Map<String, FeedAssetOracle> feeds = new ConcurrentHashMap<>();

    public FeedAssetOracle create(String symbol) {
        return feeds.computeIfAbsent(symbol.toUpperCase(), FeedAssetOracle::new);
    }

    public FeedAssetOracle get(String symbol) {
        FeedAssetOracle feed = symbol == null ? null : feeds.get(symbol.toUpperCase());
        if (feed == null) {
            throw ProtocolException.of(ErrorCode.POOL_NOT_FOUND, "no oracle feed for %s", symbol);
        }
        return feed;
    }

    public Collection<FeedAssetOracle> all() {
        return Collections.unmodifiableCollection(feeds.values());
    }
}
