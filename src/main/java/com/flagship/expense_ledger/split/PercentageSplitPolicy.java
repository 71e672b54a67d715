package com.flagship.expense_ledger.split;

import com.flagship.expense_ledger.ledger.exception.PercentageSumMismatchException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an expense by caller-supplied percentages that add up to exactly 100.
 *
 * Each share is rounded down to the minor unit; the units lost to rounding go
 * back one each to the participants with a non-zero percentage, in ledger order,
 * so the shares always add up to the amount.
 */
@Component
public class PercentageSplitPolicy implements SplitPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public String getKey() {
        return SplitType.PERCENTAGE.key();
    }

    @Override
    public Map<String, BigDecimal> split(String payerId, BigDecimal amount, List<String> participantIds,
                                         Map<String, BigDecimal> customShares) {
        Map<String, BigDecimal> percentages = CustomShares.ordered(getKey(), participantIds, customShares);

        BigDecimal percentageTotal = CustomShares.total(percentages);
        if (percentageTotal.compareTo(HUNDRED) != 0) {
            throw new PercentageSumMismatchException(percentageTotal);
        }

        int scale = amount.scale();
        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        List<String> receivers = new ArrayList<>();
        percentages.forEach((participantId, percentage) -> {
            shares.put(participantId, amount.multiply(percentage).divide(HUNDRED, scale, RoundingMode.DOWN));
            if (percentage.signum() > 0) {
                receivers.add(participantId);
            }
        });

        int leftoverUnits = amount.subtract(CustomShares.total(shares))
            .movePointRight(scale)
            .intValueExact();
        BigDecimal minorUnit = BigDecimal.ONE.movePointLeft(scale);
        for (int i = 0; i < leftoverUnits; i++) {
            shares.merge(receivers.get(i % receivers.size()), minorUnit, BigDecimal::add);
        }
        return shares;
    }
}
