package com.flagship.expense_ledger.split;

import com.flagship.expense_ledger.ledger.exception.InvalidAmountException;
import com.flagship.expense_ledger.ledger.exception.SplitSumMismatchException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uses caller-supplied amounts as the shares. They must add up to the expense amount.
 */
@Component
public class ExactSplitPolicy implements SplitPolicy {

    @Override
    public String getKey() {
        return SplitType.EXACT.key();
    }

    @Override
    public Map<String, BigDecimal> split(String payerId, BigDecimal amount, List<String> participantIds,
                                         Map<String, BigDecimal> customShares) {
        Map<String, BigDecimal> ordered = CustomShares.ordered(getKey(), participantIds, customShares);

        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        ordered.forEach((participantId, share) -> shares.put(participantId, toScale(share, amount.scale())));

        BigDecimal total = CustomShares.total(shares);
        if (total.compareTo(amount) != 0) {
            throw new SplitSumMismatchException(amount, total);
        }
        return shares;
    }

    private BigDecimal toScale(BigDecimal share, int scale) {
        try {
            return share.setScale(scale, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                String.format("Share %s has more than %d decimal places", share, scale), e);
        }
    }
}
