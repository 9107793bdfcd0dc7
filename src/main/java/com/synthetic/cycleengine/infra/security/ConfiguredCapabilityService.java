package com.synthetic.cycleengine.infra.security;

import com.synthetic.cycleengine.domain.external.CapabilityService;
import com.synthetic.cycleengine.domain.external.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allow-list backed capability service. Accounts are matched case-insensitively.
 */
@Slf4j
public class ConfiguredCapabilityService implements CapabilityService {

    private final Map<Role, Set<String>> grants = new EnumMap<>(Role.class);

    public ConfiguredCapabilityService(Collection<String> admins, Collection<String> liquidityProviders) {
        for (Role role : Role.values()) {
            grants.put(role, ConcurrentHashMap.newKeySet());
        }
        admins.forEach(a -> grant(a, Role.ADMIN));
        liquidityProviders.forEach(lp -> grant(lp, Role.LIQUIDITY_PROVIDER));
        log.info("[Capability] admins={}, liquidityProviders={}",
                grants.get(Role.ADMIN).size(), grants.get(Role.LIQUIDITY_PROVIDER).size());
    }

    @Override
    public boolean hasRole(String account, Role role) {
        return account != null && grants.get(role).contains(normalize(account));
    }

    public void grant(String account, Role role) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("account is required");
        }
        grants.get(role).add(normalize(account));
    }

    public void revoke(String account, Role role) {
        if (account != null) {
            grants.get(role).remove(normalize(account));
        }
    }

    private static String normalize(String account) {
        return account.trim().toLowerCase();
    }
}
