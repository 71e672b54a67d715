package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when exact shares do not add up to the expense amount.
 */
@Getter
public class SplitSumMismatchException extends LedgerException {

    private final BigDecimal amount;
    private final BigDecimal sharesTotal;

    public SplitSumMismatchException(BigDecimal amount, BigDecimal sharesTotal) {
        super(String.format("Custom split amounts do not sum to total amount: amount=%s, shares=%s",
            amount, sharesTotal));
        this.amount = amount;
        this.sharesTotal = sharesTotal;
    }
}
