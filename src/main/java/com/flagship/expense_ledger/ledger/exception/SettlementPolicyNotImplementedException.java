package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when a ledger settles through a policy that is declared but has no algorithm.
 */
@Getter
public class SettlementPolicyNotImplementedException extends LedgerException {

    private final String policy;

    public SettlementPolicyNotImplementedException(String policy) {
        super(String.format("Settlement policy %s is declared but not implemented", policy));
        this.policy = policy;
    }
}
