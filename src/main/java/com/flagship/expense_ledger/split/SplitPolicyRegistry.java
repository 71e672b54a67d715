package com.flagship.expense_ledger.split;

import com.flagship.expense_ledger.ledger.exception.UnknownSplitTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table from split key to policy.
 *
 * Filled once when the application context starts, from every {@link SplitPolicy}
 * bean, and consulted by key each time an expense is added. Keys are case-insensitive.
 * Extra policies can be registered, but a key can never be re-bound.
 */
@Slf4j
public class SplitPolicyRegistry {

    private final Map<String, SplitPolicy> policies = new ConcurrentHashMap<>();

    public SplitPolicyRegistry(List<SplitPolicy> policies) {
        policies.forEach(policy -> register(policy.getKey(), policy));
    }

    /**
     * Registry holding the {@link SplitType} policies, for use outside a Spring context.
     */
    public static SplitPolicyRegistry withBuiltIns() {
        return new SplitPolicyRegistry(List.of(
            new EqualSplitPolicy(),
            new ExactSplitPolicy(),
            new PercentageSplitPolicy()
        ));
    }

    /**
     * Binds a policy to a key.
     *
     * @throws IllegalStateException if the key is already bound
     */
    public void register(String key, SplitPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Split policy cannot be null");
        }
        String normalized = normalize(key);
        SplitPolicy existing = policies.putIfAbsent(normalized, policy);
        if (existing != null) {
            throw new IllegalStateException("Split policy already registered for key: " + normalized);
        }
        log.debug("Registered split policy: key={}, policy={}", normalized, policy.getClass().getSimpleName());
    }

    /**
     * @throws UnknownSplitTypeException if nothing is registered under the key
     */
    public SplitPolicy resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new UnknownSplitTypeException(key);
        }
        SplitPolicy policy = policies.get(normalize(key));
        if (policy == null) {
            throw new UnknownSplitTypeException(key);
        }
        return policy;
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(policies.keySet()));
    }

    private static String normalize(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Split policy key is required");
        }
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
