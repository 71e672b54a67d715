package com.flagship.expense_ledger.ledger;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outstanding debt per ordered pair: debtor id -> creditor id -> amount owed.
 *
 * Key invariant: every stored amount is strictly positive. An entry that drops to
 * zero is removed, so an absent entry and a zero entry mean the same thing.
 * Reads never create entries.
 *
 * Not thread-safe on its own; the owning {@link Ledger} guards it.
 */
public class BalanceSheet {

    private final Map<String, Map<String, BigDecimal>> outstanding = new LinkedHashMap<>();

    /**
     * Amount {@code debtorId} owes {@code creditorId}, zero if nothing is recorded.
     */
    public BigDecimal getOutstanding(String debtorId, String creditorId) {
        Map<String, BigDecimal> creditors = outstanding.get(debtorId);
        if (creditors == null) {
            return BigDecimal.ZERO;
        }
        return creditors.getOrDefault(creditorId, BigDecimal.ZERO);
    }

    public boolean hasOutstanding(String debtorId, String creditorId) {
        return getOutstanding(debtorId, creditorId).signum() > 0;
    }

    /**
     * Adds to the debt of {@code debtorId} towards {@code creditorId}.
     */
    public void increase(String debtorId, String creditorId, BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Balance increase must not be negative: " + amount);
        }
        if (amount.signum() == 0) {
            return;
        }
        outstanding.computeIfAbsent(debtorId, id -> new LinkedHashMap<>())
            .merge(creditorId, amount, BigDecimal::add);
    }

    /**
     * Reduces the debt of {@code debtorId} towards {@code creditorId}.
     *
     * @throws IllegalStateException if the result would be negative
     */
    public void decrease(String debtorId, String creditorId, BigDecimal amount) {
        BigDecimal remaining = getOutstanding(debtorId, creditorId).subtract(amount);
        if (remaining.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Balance of %s towards %s would become negative: %s", debtorId, creditorId, remaining));
        }
        if (remaining.signum() == 0) {
            Map<String, BigDecimal> creditors = outstanding.get(debtorId);
            if (creditors != null) {
                creditors.remove(creditorId);
                if (creditors.isEmpty()) {
                    outstanding.remove(debtorId);
                }
            }
        } else {
            outstanding.get(debtorId).put(creditorId, remaining);
        }
    }

    public boolean isEmpty() {
        return outstanding.isEmpty();
    }

    /**
     * Deep, unmodifiable copy of the current state.
     */
    public Map<String, Map<String, BigDecimal>> snapshot() {
        Map<String, Map<String, BigDecimal>> copy = new LinkedHashMap<>();
        outstanding.forEach((debtorId, creditors) ->
            copy.put(debtorId, Collections.unmodifiableMap(new LinkedHashMap<>(creditors))));
        return Collections.unmodifiableMap(copy);
    }
}
