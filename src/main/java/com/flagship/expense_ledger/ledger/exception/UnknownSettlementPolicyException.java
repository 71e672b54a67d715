package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when a ledger is created with a settlement policy key that is not registered.
 */
@Getter
public class UnknownSettlementPolicyException extends LedgerException {

    private final String policy;

    public UnknownSettlementPolicyException(String policy) {
        super("Settlement policy does not exist: " + policy);
        this.policy = policy;
    }
}
