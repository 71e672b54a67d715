package com.flagship.expense_ledger.split;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an expense evenly across every participant, payer included.
 *
 * When the amount does not divide evenly in minor units, the leftover units go
 * one each to the first participants in ledger order. The payer's share is part
 * of the result even though it never turns into a debt.
 */
@Component
public class EqualSplitPolicy implements SplitPolicy {

    @Override
    public String getKey() {
        return SplitType.EQUAL.key();
    }

    @Override
    public Map<String, BigDecimal> split(String payerId, BigDecimal amount, List<String> participantIds,
                                         Map<String, BigDecimal> customShares) {
        if (participantIds == null || participantIds.isEmpty()) {
            throw new IllegalArgumentException("Equal split needs at least one participant");
        }

        int scale = amount.scale();
        BigDecimal count = BigDecimal.valueOf(participantIds.size());
        BigDecimal perHead = amount.divide(count, scale, RoundingMode.DOWN);
        int leftoverUnits = amount.subtract(perHead.multiply(count))
            .movePointRight(scale)
            .intValueExact();
        BigDecimal minorUnit = BigDecimal.ONE.movePointLeft(scale);

        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        for (int i = 0; i < participantIds.size(); i++) {
            shares.put(participantIds.get(i), i < leftoverUnits ? perHead.add(minorUnit) : perHead);
        }
        return shares;
    }
}
