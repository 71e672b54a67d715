package com.flagship.expense_ledger.settlement;

import com.flagship.expense_ledger.ledger.exception.UnknownSettlementPolicyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table from settlement policy key to policy, filled when the context starts.
 *
 * A ledger resolves its policy once, at creation. Keys are case-insensitive and
 * can never be re-bound.
 */
@Slf4j
public class SettlementPolicyRegistry {

    private final Map<String, SettlementPolicy> policies = new ConcurrentHashMap<>();

    public SettlementPolicyRegistry(List<SettlementPolicy> policies) {
        policies.forEach(policy -> register(policy.getKey(), policy));
    }

    public static SettlementPolicyRegistry withBuiltIns() {
        return new SettlementPolicyRegistry(List.of(
            new DirectPairwiseSettlementPolicy(),
            new GraphMinimizingSettlementPolicy()
        ));
    }

    /**
     * @throws IllegalStateException if the key is already bound
     */
    public void register(String key, SettlementPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Settlement policy cannot be null");
        }
        String normalized = normalize(key);
        SettlementPolicy existing = policies.putIfAbsent(normalized, policy);
        if (existing != null) {
            throw new IllegalStateException("Settlement policy already registered for key: " + normalized);
        }
        log.debug("Registered settlement policy: key={}, policy={}",
            normalized, policy.getClass().getSimpleName());
    }

    /**
     * @throws UnknownSettlementPolicyException if nothing is registered under the key
     */
    public SettlementPolicy resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new UnknownSettlementPolicyException(key);
        }
        SettlementPolicy policy = policies.get(normalize(key));
        if (policy == null) {
            throw new UnknownSettlementPolicyException(key);
        }
        return policy;
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(policies.keySet()));
    }

    private static String normalize(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Settlement policy key is required");
        }
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
