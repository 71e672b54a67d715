package com.flagship.expense_ledger.settlement;

import com.flagship.expense_ledger.ledger.BalanceSheet;
import com.flagship.expense_ledger.ledger.Participant;

import java.math.BigDecimal;

/**
 * Reduces an outstanding debt when one participant repays another.
 *
 * Implementations validate against the balance sheet before changing anything:
 * a rejected settlement leaves both the sheet and the participants untouched.
 * Called by the ledger while it holds its write lock.
 */
public interface SettlementPolicy {

    /**
     * Key this policy is registered under, e.g. {@code DIRECT_PAIRWISE}.
     */
    String getKey();

    /**
     * Records that {@code payer} paid {@code amount} to {@code payee}.
     *
     * @param payer Participant repaying a debt
     * @param payee Participant being repaid
     * @param amount Positive amount at the currency scale
     * @param balanceSheet The ledger's balance sheet, updated in place
     */
    void settle(Participant payer, Participant payee, BigDecimal amount, BalanceSheet balanceSheet);
}
