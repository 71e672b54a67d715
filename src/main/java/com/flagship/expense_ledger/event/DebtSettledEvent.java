package com.flagship.expense_ledger.event;

import com.flagship.expense_ledger.ledger.Settlement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event recorded when a participant has repaid (part of) a debt.
 *
 * Carries what is still outstanding for the pair, so consumers do not need
 * to replay the whole ledger to know whether the debt is cleared.
 */
@Value
public class DebtSettledEvent implements LedgerEvent {
    UUID eventId;
    String ledgerId;
    String settlementId;
    String payerId;
    String payeeId;
    BigDecimal amount;
    BigDecimal remaining;
    String currency;
    String policy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DebtSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DebtSettledEvent fromSettlement(Settlement settlement, BigDecimal remaining, String currency) {
        return new DebtSettledEvent(
            UUID.randomUUID(),
            settlement.getLedgerId(),
            settlement.getId(),
            settlement.getPayerId(),
            settlement.getPayeeId(),
            settlement.getAmount(),
            remaining,
            currency,
            settlement.getPolicy(),
            settlement.getSettledAt()
        );
    }
}
