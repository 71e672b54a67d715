package com.flagship.expense_ledger.event;

import com.flagship.expense_ledger.ledger.Expense;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Event recorded when an expense has been added to a ledger and applied to its balances.
 */
@Value
public class ExpenseAddedEvent implements LedgerEvent {
    UUID eventId;
    String ledgerId;
    String expenseId;
    String payerId;
    BigDecimal amount;
    String currency;
    String splitType;
    Map<String, BigDecimal> splits;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseAddedEvent fromExpense(Expense expense, String currency) {
        return new ExpenseAddedEvent(
            UUID.randomUUID(),
            expense.getLedgerId(),
            expense.getId(),
            expense.getPayerId(),
            expense.getAmount(),
            currency,
            expense.getSplitType(),
            expense.getSplits(),
            expense.getDescription(),
            expense.getCreatedAt()
        );
    }
}
