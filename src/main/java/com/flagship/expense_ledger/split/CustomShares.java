package com.flagship.expense_ledger.split;

import com.flagship.expense_ledger.ledger.exception.InvalidAmountException;
import com.flagship.expense_ledger.ledger.exception.MissingCustomSharesException;
import com.flagship.expense_ledger.ledger.exception.UnknownParticipantException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation shared by the policies that take caller-supplied shares.
 */
final class CustomShares {

    private CustomShares() {
    }

    /**
     * Checks the supplied shares and returns them in ledger participant order.
     */
    static Map<String, BigDecimal> ordered(String splitType, List<String> participantIds,
                                           Map<String, BigDecimal> customShares) {
        if (customShares == null || customShares.isEmpty()) {
            throw new MissingCustomSharesException(splitType);
        }
        for (Map.Entry<String, BigDecimal> entry : customShares.entrySet()) {
            if (!participantIds.contains(entry.getKey())) {
                throw new UnknownParticipantException(entry.getKey());
            }
            if (entry.getValue() == null || entry.getValue().signum() < 0) {
                throw new InvalidAmountException(
                    String.format("Share for %s must not be negative: %s", entry.getKey(), entry.getValue()));
            }
        }

        Map<String, BigDecimal> ordered = new LinkedHashMap<>();
        for (String participantId : participantIds) {
            BigDecimal share = customShares.get(participantId);
            if (share != null) {
                ordered.put(participantId, share);
            }
        }
        return ordered;
    }

    static BigDecimal total(Map<String, BigDecimal> shares) {
        return shares.values().stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
