package com.flagship.expense_ledger.observability;

import com.flagship.expense_ledger.journal.LedgerJournal;
import com.flagship.expense_ledger.ledger.Ledger;
import com.flagship.expense_ledger.ledger.LedgerService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Custom health indicators for the expense ledger.
 */
public class HealthIndicators {

    /**
     * Down as soon as any ledger's participant balances stop summing to zero.
     */
    @Component("ledgerConservationHealth")
    public static class LedgerConservationHealthIndicator implements HealthIndicator {

        private final LedgerService ledgerService;

        public LedgerConservationHealthIndicator(LedgerService ledgerService) {
            this.ledgerService = ledgerService;
        }

        @Override
        public Health health() {
            List<Ledger> ledgers = ledgerService.getLedgers();
            List<String> unbalanced = ledgers.stream()
                    .filter(ledger -> !ledger.isBalanced())
                    .map(Ledger::getId)
                    .toList();

            Health.Builder builder = unbalanced.isEmpty() ? Health.up() : Health.down();
            return builder
                    .withDetail("ledgerCount", ledgers.size())
                    .withDetail("unbalancedLedgers", unbalanced)
                    .build();
        }
    }

    /**
     * Reports how many events the journal holds.
     */
    @Component("ledgerJournalHealth")
    public static class LedgerJournalHealthIndicator implements HealthIndicator {

        private final LedgerJournal journal;

        public LedgerJournalHealthIndicator(LedgerJournal journal) {
            this.journal = journal;
        }

        @Override
        public Health health() {
            return Health.up()
                    .withDetail("entries", journal.count())
                    .build();
        }
    }
}
