package com.flagship.expense_ledger.split;

/**
 * Built-in ways of dividing an expense between ledger participants.
 */
public enum SplitType {
    /**
     * Everyone, payer included, carries the same share.
     */
    EQUAL,

    /**
     * Caller supplies the exact amount each participant carries.
     */
    EXACT,

    /**
     * Caller supplies a percentage per participant; percentages add up to 100.
     */
    PERCENTAGE;

    /**
     * Registry key of the policy implementing this split type.
     */
    public String key() {
        return name();
    }
}
