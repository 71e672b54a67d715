package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.config.JacksonConfig;
import com.flagship.expense_ledger.journal.JournalEntry;
import com.flagship.expense_ledger.journal.LedgerJournal;
import com.flagship.expense_ledger.ledger.exception.NoOutstandingBalanceException;
import com.flagship.expense_ledger.ledger.exception.SettlementPolicyNotImplementedException;
import com.flagship.expense_ledger.ledger.exception.UnknownLedgerException;
import com.flagship.expense_ledger.ledger.exception.UnknownParticipantException;
import com.flagship.expense_ledger.ledger.exception.UnknownSettlementPolicyException;
import com.flagship.expense_ledger.ledger.exception.UnknownSplitTypeException;
import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.settlement.SettlementPolicyRegistry;
import com.flagship.expense_ledger.split.SplitPolicy;
import com.flagship.expense_ledger.split.SplitPolicyRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service-level tests: registry of ledgers and participants, metrics and journal.
 *
 * These tests verify that:
 * - Ledgers are created over known participants with the configured defaults
 * - Each committed change lands in the journal exactly once
 * - Success and rejection are counted per split type and settlement policy
 * - Policies registered at runtime are usable by ledgers
 */
class LedgerServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private LedgerJournal journal;
    private LedgerService ledgerService;

    private Participant alice;
    private Participant bob;
    private Participant charlie;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        journal = new LedgerJournal(new JacksonConfig().objectMapper());
        ledgerService = new LedgerService(
            SplitPolicyRegistry.withBuiltIns(),
            SettlementPolicyRegistry.withBuiltIns(),
            journal,
            new LedgerMetrics(meterRegistry),
            CurrencyCode.INR,
            "DIRECT_PAIRWISE");

        alice = ledgerService.createParticipant("Alice");
        bob = ledgerService.createParticipant("Bob");
        charlie = ledgerService.createParticipant("Charlie");
    }

    private List<String> ids(Participant... participants) {
        return Arrays.stream(participants).map(Participant::getId).toList();
    }

    private double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }

    @Nested
    @DisplayName("Creating ledgers")
    class CreateLedgerTests {

        @Test
        @DisplayName("Defaults apply when no policy or currency is given")
        void testDefaults() {
            Ledger ledger = ledgerService.createLedger("Goa Trip", ids(alice, bob, charlie));

            assertEquals(CurrencyCode.INR, ledger.getCurrency());
            assertEquals("DIRECT_PAIRWISE", ledger.getSettlementPolicyKey());
            assertEquals(ids(alice, bob, charlie), ledger.getParticipantIds());
            assertSame(ledger, ledgerService.getLedger(ledger.getId()));
            assertEquals(1.0, counter("ledger.created", "settlement_policy", "DIRECT_PAIRWISE"));
            assertEquals(1.0, meterRegistry.get("ledger.count").gauge().value());
            assertEquals(3.0, meterRegistry.get("ledger.participants.created").counter().count());
        }

        @Test
        @DisplayName("Unknown policy keys and participants fail before anything is created")
        void testRejectedCreation() {
            assertThrows(UnknownSettlementPolicyException.class,
                () -> ledgerService.createLedger("Trip", ids(alice), "BRUTE_FORCE"));
            assertThrows(UnknownParticipantException.class,
                () -> ledgerService.createLedger("Trip", List.of(alice.getId(), "nobody")));

            assertTrue(ledgerService.getLedgers().isEmpty());
            assertNotNull(ledgerService.createLedger("Trip", ids(alice)));
        }

        @Test
        @DisplayName("A participant cannot join a second ledger")
        void testParticipantInTwoLedgers() {
            ledgerService.createLedger("Trip", ids(alice, bob));

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ledgerService.createLedger("Flat", ids(bob, charlie)));
            assertTrue(e.getMessage().contains(bob.getId()));
            assertEquals(1, ledgerService.getLedgers().size());
        }

        @Test
        @DisplayName("Explicit currency is used for the ledger")
        void testExplicitCurrency() {
            Ledger ledger = ledgerService.createLedger("Tokyo", ids(alice, bob), "GRAPH_MINIMIZING", CurrencyCode.JPY);

            Expense expense = ledgerService.addExpense(ledger.getId(), alice.getId(), new BigDecimal("1001"),
                "EQUAL", null, "ramen");
            assertEquals(new BigDecimal("501"), expense.getSplits().get(alice.getId()));
            assertEquals(new BigDecimal("500"), ledger.getOutstanding(bob.getId(), alice.getId()));
        }

        @Test
        void testUnknownLookups() {
            assertThrows(UnknownLedgerException.class, () -> ledgerService.getLedger("missing"));
            assertThrows(UnknownParticipantException.class, () -> ledgerService.getParticipant("missing"));
            assertSame(alice, ledgerService.getParticipant(alice.getId()));
        }
    }

    @Nested
    @DisplayName("Operations")
    class OperationTests {

        private Ledger ledger;

        @BeforeEach
        void createLedger() {
            ledger = ledgerService.createLedger("Goa Trip", ids(alice, bob, charlie));
        }

        @Test
        @DisplayName("Expense and settlement are journaled in order and counted")
        void testJournalAndMetrics() {
            ledgerService.addExpense(ledger.getId(), alice.getId(), new BigDecimal("300"), "equal", null, "hotel");
            ledgerService.settle(ledger.getId(), bob.getId(), alice.getId(), new BigDecimal("100"));

            List<JournalEntry> entries = journal.getEntriesForLedger(ledger.getId());
            assertEquals(2, entries.size());
            assertEquals("ExpenseAdded", entries.get(0).getEventType());
            assertEquals("DebtSettled", entries.get(1).getEventType());
            assertEquals(1L, entries.get(0).getSequenceNumber());
            assertEquals(2L, entries.get(1).getSequenceNumber());

            assertEquals(1.0, counter("ledger.expenses", "split_type", "EQUAL", "status", "success"));
            assertEquals(1.0, counter("ledger.settlements", "policy", "DIRECT_PAIRWISE", "status", "success"));
            assertEquals(1L, meterRegistry.get("ledger.operation.latency").tag("operation", "settle").timer().count());
            assertFalse(ledgerService.getPassbook(ledger.getId()).containsKey(bob.getId()));
        }

        @Test
        @DisplayName("Rejected operations are counted, rethrown unchanged and not journaled")
        void testRejections() {
            assertThrows(UnknownSplitTypeException.class, () -> ledgerService.addExpense(
                ledger.getId(), alice.getId(), new BigDecimal("10"), "WEIGHTED", null, null));
            assertThrows(NoOutstandingBalanceException.class, () -> ledgerService.settle(
                ledger.getId(), bob.getId(), alice.getId(), new BigDecimal("10")));
            assertThrows(UnknownLedgerException.class, () -> ledgerService.settle(
                "missing", bob.getId(), alice.getId(), new BigDecimal("10")));

            assertEquals(1.0, counter("ledger.expenses", "split_type", "WEIGHTED", "status", "rejected"));
            assertEquals(1.0, counter("ledger.settlements", "policy", "DIRECT_PAIRWISE", "status", "rejected"));
            assertEquals(1.0, counter("ledger.settlements", "policy", "unknown", "status", "rejected"));
            assertEquals(0, journal.count());
        }

        @Test
        @DisplayName("Graph-minimizing ledger refuses settlements through the service")
        void testGraphMinimizingThroughService() {
            Participant dave = ledgerService.createParticipant("Dave");
            Participant erin = ledgerService.createParticipant("Erin");
            Ledger graphLedger = ledgerService.createLedger("Flat", ids(dave, erin), "graph_minimizing");
            ledgerService.addExpense(graphLedger.getId(), dave.getId(), new BigDecimal("50"), "EQUAL", null, null);

            assertThrows(SettlementPolicyNotImplementedException.class, () -> ledgerService.settle(
                graphLedger.getId(), erin.getId(), dave.getId(), new BigDecimal("25")));
            assertEquals(new BigDecimal("25.00"), graphLedger.getOutstanding(erin.getId(), dave.getId()));
            assertEquals(1.0, counter("ledger.settlements", "policy", "GRAPH_MINIMIZING", "status", "rejected"));
        }

        @Test
        @DisplayName("A split policy registered at runtime is usable immediately")
        void testRegisterSplitPolicy() {
            SplitPolicy payerOnly = new SplitPolicy() {
                @Override
                public String getKey() {
                    return "PAYER_ONLY";
                }

                @Override
                public Map<String, BigDecimal> split(String payerId, BigDecimal amount, List<String> participantIds,
                                                     Map<String, BigDecimal> customShares) {
                    Map<String, BigDecimal> splits = new LinkedHashMap<>();
                    participantIds.forEach(id -> splits.put(id, id.equals(payerId) ? amount : BigDecimal.ZERO));
                    return splits;
                }
            };

            ledgerService.registerSplitPolicy("PAYER_ONLY", payerOnly);
            Expense expense = ledgerService.addExpense(ledger.getId(), alice.getId(), new BigDecimal("40"),
                "payer_only", null, "own coffee");

            assertEquals("PAYER_ONLY", expense.getSplitType());
            assertTrue(ledger.getPassbook().isEmpty());
            assertThrows(IllegalStateException.class, () -> ledgerService.registerSplitPolicy("PAYER_ONLY", payerOnly));
        }
    }
}
