package com.flagship.expense_ledger.settlement;

import com.flagship.expense_ledger.ledger.BalanceSheet;
import com.flagship.expense_ledger.ledger.Participant;
import com.flagship.expense_ledger.ledger.exception.NoOutstandingBalanceException;
import com.flagship.expense_ledger.ledger.exception.SettlementExceedsBalanceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Settles against the single balance-sheet entry for the ordered pair (payer, payee).
 *
 * The reverse direction of the pair is never consulted: what the payee owes the
 * payer is a separate entry and stays as it is.
 */
@Component
@Slf4j
public class DirectPairwiseSettlementPolicy implements SettlementPolicy {

    @Override
    public String getKey() {
        return SettlementPolicyType.DIRECT_PAIRWISE.key();
    }

    /**
     * @throws NoOutstandingBalanceException if the payer owes the payee nothing
     * @throws SettlementExceedsBalanceException if the amount is more than the payer owes
     */
    @Override
    public void settle(Participant payer, Participant payee, BigDecimal amount, BalanceSheet balanceSheet) {
        if (!balanceSheet.hasOutstanding(payer.getId(), payee.getId())) {
            throw new NoOutstandingBalanceException(payer.getId(), payee.getId());
        }
        BigDecimal outstanding = balanceSheet.getOutstanding(payer.getId(), payee.getId());
        if (amount.compareTo(outstanding) > 0) {
            throw new SettlementExceedsBalanceException(amount, outstanding);
        }

        balanceSheet.decrease(payer.getId(), payee.getId(), amount);
        payee.adjustBalance(payer.getId(), amount.negate());
        payer.adjustBalance(payee.getId(), amount);

        log.debug("Reduced debt: payer={}, payee={}, amount={}, remaining={}",
            payer.getId(), payee.getId(), amount, outstanding.subtract(amount));
    }
}
