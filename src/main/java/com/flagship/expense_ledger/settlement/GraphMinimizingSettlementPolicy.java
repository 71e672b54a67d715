package com.flagship.expense_ledger.settlement;

import com.flagship.expense_ledger.ledger.BalanceSheet;
import com.flagship.expense_ledger.ledger.Participant;
import com.flagship.expense_ledger.ledger.exception.SettlementPolicyNotImplementedException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Placeholder for settling with a minimal set of group-wide transfers.
 *
 * The policy can be selected so ledgers may be created with it, but every
 * settlement through it is rejected before any state is touched. For a read-only
 * view of minimal transfers see {@link DebtSimplifier}.
 */
@Component
public class GraphMinimizingSettlementPolicy implements SettlementPolicy {

    @Override
    public String getKey() {
        return SettlementPolicyType.GRAPH_MINIMIZING.key();
    }

    @Override
    public void settle(Participant payer, Participant payee, BigDecimal amount, BalanceSheet balanceSheet) {
        throw new SettlementPolicyNotImplementedException(getKey());
    }
}
