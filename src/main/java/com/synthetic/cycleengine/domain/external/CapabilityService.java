package com.synthetic.cycleengine.domain.external;

/**
 * Answers who may do what. Injected into every pool instead of being looked up globally.
 */
public interface CapabilityService {

    boolean hasRole(String account, Role role);
}
