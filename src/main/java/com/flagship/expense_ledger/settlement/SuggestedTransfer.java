package com.flagship.expense_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One payment that would help clear a ledger: {@code fromId} pays {@code toId}.
 */
@Value
public class SuggestedTransfer {
    String fromId;
    String toId;
    BigDecimal amount;
}
