package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.event.LedgerEvent;

/**
 * Receives ledger events after the change they describe has been applied in memory.
 *
 * The ledger calls the sink while still holding its write lock, so events arrive
 * in commit order. The in-memory ledger stays the source of truth: an exception
 * from the sink is logged by the ledger and never undoes or fails the change.
 */
@FunctionalInterface
public interface LedgerEventSink {

    LedgerEventSink NONE = event -> { };

    void publish(LedgerEvent event);
}
