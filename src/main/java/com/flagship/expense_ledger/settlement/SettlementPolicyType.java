package com.flagship.expense_ledger.settlement;

/**
 * Settlement policies a ledger can be created with.
 */
public enum SettlementPolicyType {
    /**
     * Repays the recorded debt of one ordered pair directly.
     */
    DIRECT_PAIRWISE,

    /**
     * Reserved for group-wide transfer minimization. Declared but has no algorithm;
     * settling through it fails.
     */
    GRAPH_MINIMIZING;

    public String key() {
        return name();
    }
}
