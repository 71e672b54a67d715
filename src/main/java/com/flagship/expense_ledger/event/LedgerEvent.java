package com.flagship.expense_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * All ledger events share these common properties:
 * - Event ID for deduplication
 * - Ledger ID (aggregate ID)
 * - Timestamp of when the event occurred
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The ledger this event is about.
     */
    String getLedgerId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
