package com.flagship.expense_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded repayment from {@code payerId} to {@code payeeId}.
 */
@Value
public class Settlement {
    String id;
    String ledgerId;
    String payerId;
    String payeeId;
    BigDecimal amount;
    String policy;
    Instant settledAt;

    public static Settlement create(String ledgerId, String payerId, String payeeId,
                                    BigDecimal amount, String policy) {
        return new Settlement(
            UUID.randomUUID().toString(),
            ledgerId,
            payerId,
            payeeId,
            amount,
            policy,
            Instant.now()
        );
    }
}
