package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class AssetPoolRegistry {

    private final Map<String, AssetPool> pools = new ConcurrentHashMap<>();

    public void register(AssetPool pool) {
        if (pools.putIfAbsent(pool.symbol(), pool) != null) {
            throw new IllegalStateException("pool already registered: " + pool.symbol());
        }
    }

    public AssetPool get(String symbol) {
        AssetPool pool = symbol == null ? null : pools.get(symbol.toUpperCase());
        if (pool == null) {
            throw ProtocolException.of(ErrorCode.POOL_NOT_FOUND, "symbol=%s", symbol);
        }
        return pool;
    }

    public Collection<AssetPool> all() {
        return Collections.unmodifiableCollection(pools.values());
    }
}
