package com.flagship.expense_ledger.ledger;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A member of a ledger, with a running balance against each counterparty.
 *
 * A positive balance against a counterparty means this participant is owed by
 * them; a negative balance means this participant owes them. Zero balances are
 * not stored, and looking up an unknown counterparty never creates an entry.
 *
 * Identity is the opaque {@link #getId() id}; two instances with the same id are equal.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Participant {

    @EqualsAndHashCode.Include
    private final String id;
    private final String name;

    @Getter(AccessLevel.NONE)
    private final Map<String, BigDecimal> balances = new LinkedHashMap<>();

    private Participant(String id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * Creates a participant with a freshly generated id.
     */
    public static Participant create(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Participant name is required");
        }
        return new Participant(UUID.randomUUID().toString(), name);
    }

    /**
     * Balance against a single counterparty, zero if none is recorded.
     */
    public synchronized BigDecimal getBalanceWith(String counterpartyId) {
        return balances.getOrDefault(counterpartyId, BigDecimal.ZERO);
    }

    /**
     * Snapshot of all non-zero balances, keyed by counterparty id.
     */
    public synchronized Map<String, BigDecimal> getBalances() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }

    /**
     * Sum of all balances. Positive when this participant is a net creditor.
     */
    public synchronized BigDecimal getNetBalance() {
        return balances.values().stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Moves the balance against a counterparty by {@code delta}.
     *
     * Only ledgers and settlement policies call this, while holding the ledger's write lock.
     */
    public synchronized void adjustBalance(String counterpartyId, BigDecimal delta) {
        BigDecimal updated = getBalanceWith(counterpartyId).add(delta);
        if (updated.signum() == 0) {
            balances.remove(counterpartyId);
        } else {
            balances.put(counterpartyId, updated);
        }
    }

    @Override
    public String toString() {
        return String.format("Participant(%s, id=%s)", name, id);
    }
}
