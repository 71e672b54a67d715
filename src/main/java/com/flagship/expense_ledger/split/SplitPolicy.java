package com.flagship.expense_ledger.split;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Turns an expense into a share per participant.
 *
 * Implementations are pure: they read their arguments and return a new map,
 * without touching any ledger state. The amount is already at the currency
 * scale and every returned share has that same scale.
 */
public interface SplitPolicy {

    /**
     * Key this policy is registered under, e.g. {@code EQUAL}.
     */
    String getKey();

    /**
     * Computes the shares of one expense.
     *
     * @param payerId Participant who paid
     * @param amount Positive expense amount
     * @param participantIds Ledger participants, in ledger order
     * @param customShares Per-participant input for policies that need it, may be null
     * @return Share per participant id, ordered like {@code participantIds}, adding up to {@code amount}
     */
    Map<String, BigDecimal> split(String payerId, BigDecimal amount, List<String> participantIds,
                                  Map<String, BigDecimal> customShares);
}
