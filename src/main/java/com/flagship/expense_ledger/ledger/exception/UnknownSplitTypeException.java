package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when an expense names a split type that no policy is registered for.
 */
@Getter
public class UnknownSplitTypeException extends LedgerException {

    private final String splitType;

    public UnknownSplitTypeException(String splitType) {
        super("Invalid split type: " + splitType);
        this.splitType = splitType;
    }
}
