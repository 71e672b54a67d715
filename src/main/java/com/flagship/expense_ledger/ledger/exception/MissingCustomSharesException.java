package com.flagship.expense_ledger.ledger.exception;

/**
 * Thrown when a split type that needs per-participant shares is used without them.
 */
public class MissingCustomSharesException extends LedgerException {

    public MissingCustomSharesException(String splitType) {
        super(String.format("Custom shares are required for %s split", splitType));
    }
}
