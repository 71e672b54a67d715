package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when a settlement amount is larger than the debt it is meant to reduce.
 */
@Getter
public class SettlementExceedsBalanceException extends LedgerException {

    private final BigDecimal amount;
    private final BigDecimal outstanding;

    public SettlementExceedsBalanceException(BigDecimal amount, BigDecimal outstanding) {
        super(String.format("Settlement amount exceeds the outstanding balance: amount=%s, outstanding=%s",
            amount, outstanding));
        this.amount = amount;
        this.outstanding = outstanding;
    }
}
