package com.flagship.expense_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One spend event in a ledger, together with the split that was computed for it.
 *
 * Key invariant: the splits add up to the amount exactly.
 * Expenses are never edited or removed once recorded.
 */
@Value
public class Expense {
    String id;
    String ledgerId;
    String payerId;
    BigDecimal amount;
    String splitType;
    Map<String, BigDecimal> splits;
    String description;
    Instant createdAt;

    private Expense(String id, String ledgerId, String payerId, BigDecimal amount, String splitType,
                    Map<String, BigDecimal> splits, String description, Instant createdAt) {
        this.id = id;
        this.ledgerId = ledgerId;
        this.payerId = payerId;
        this.amount = amount;
        this.splitType = splitType;
        this.splits = Collections.unmodifiableMap(new LinkedHashMap<>(splits));
        this.description = description;
        this.createdAt = createdAt;
    }

    /**
     * Creates a new expense from an already computed split.
     *
     * @throws IllegalArgumentException if the splits do not add up to the amount
     */
    public static Expense create(String ledgerId, String payerId, BigDecimal amount, String splitType,
                                 Map<String, BigDecimal> splits, String description) {
        BigDecimal total = splits.values().stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.compareTo(amount) != 0) {
            throw new IllegalArgumentException(
                String.format("Expense splits do not add up: amount=%s, splits=%s", amount, total));
        }
        return new Expense(UUID.randomUUID().toString(), ledgerId, payerId, amount, splitType,
            splits, description == null ? "" : description, Instant.now());
    }

    /**
     * Applies the split to participant balances.
     *
     * Every non-payer share becomes a debt towards the payer. The payer's own share
     * is part of the split but has no balance effect, since the payer already paid it.
     *
     * @param participants Ledger participants keyed by id
     */
    void applyTo(Map<String, Participant> participants) {
        Participant payer = participants.get(payerId);
        splits.forEach((participantId, share) -> {
            if (participantId.equals(payerId)) {
                return;
            }
            participants.get(participantId).adjustBalance(payerId, share.negate());
            payer.adjustBalance(participantId, share);
        });
    }

    /**
     * Shares owed to the payer, i.e. the split without the payer's own share.
     */
    public Map<String, BigDecimal> getOwedShares() {
        Map<String, BigDecimal> owed = new LinkedHashMap<>();
        splits.forEach((participantId, share) -> {
            if (!participantId.equals(payerId) && share.signum() > 0) {
                owed.put(participantId, share);
            }
        });
        return Collections.unmodifiableMap(owed);
    }
}
