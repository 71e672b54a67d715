package com.flagship.expense_ledger.journal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One serialized ledger event in the journal.
 *
 * Key properties:
 * - Immutable value object
 * - Payload is the JSON form of the event
 * - Sequence numbers are unique and increase in commit order across all ledgers
 */
@Value
public class JournalEntry {
    UUID id;
    String aggregateType;      // always "Ledger"
    String aggregateId;        // ledger ID
    String eventType;          // e.g., "ExpenseAdded"
    String payload;            // JSON payload
    Instant createdAt;
    long sequenceNumber;

    public static JournalEntry create(String aggregateType, String aggregateId, String eventType,
                                      String payload, long sequenceNumber) {
        return new JournalEntry(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            sequenceNumber
        );
    }
}
