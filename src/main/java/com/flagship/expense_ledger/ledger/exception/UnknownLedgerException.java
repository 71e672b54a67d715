package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

@Getter
public class UnknownLedgerException extends LedgerException {

    private final String ledgerId;

    public UnknownLedgerException(String ledgerId) {
        super("Ledger not found: " + ledgerId);
        this.ledgerId = ledgerId;
    }
}
