package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when percentage shares do not add up to 100.
 */
@Getter
public class PercentageSumMismatchException extends LedgerException {

    private final BigDecimal percentageTotal;

    public PercentageSumMismatchException(BigDecimal percentageTotal) {
        super(String.format("Percentage splits must sum to 100%%, got %s%%", percentageTotal));
        this.percentageTotal = percentageTotal;
    }
}
