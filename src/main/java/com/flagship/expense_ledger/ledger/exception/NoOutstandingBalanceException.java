package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when a settlement is requested for a pair that has no recorded debt.
 */
@Getter
public class NoOutstandingBalanceException extends LedgerException {

    private final String payerId;
    private final String payeeId;

    public NoOutstandingBalanceException(String payerId, String payeeId) {
        super(String.format("No outstanding balance between %s and %s", payerId, payeeId));
        this.payerId = payerId;
        this.payeeId = payeeId;
    }
}
