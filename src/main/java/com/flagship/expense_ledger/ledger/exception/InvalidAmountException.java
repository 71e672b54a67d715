package com.flagship.expense_ledger.ledger.exception;

/**
 * Thrown for amounts the ledger cannot record: non-positive expense or settlement
 * amounts, negative shares, and values more precise than the currency's minor unit.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
