package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.ledger.exception.LedgerException;
import com.flagship.expense_ledger.settlement.SettlementPolicyRegistry;
import com.flagship.expense_ledger.split.SplitPolicyRegistry;
import com.flagship.expense_ledger.split.SplitType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent writers against a single ledger.
 *
 * Expenses and settlements are serialized by the ledger's write lock, so no
 * update is lost and a debt is never settled past zero.
 */
class LedgerConcurrencyTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private Ledger newLedger(Participant... participants) {
        return Ledger.create("Flat", List.of(participants), CurrencyCode.INR,
            SettlementPolicyRegistry.withBuiltIns().resolve("DIRECT_PAIRWISE"),
            SplitPolicyRegistry.withBuiltIns(), LedgerEventSink.NONE);
    }

    @Test
    @DisplayName("Concurrent expenses: every share is counted exactly once")
    void testConcurrentExpenses() throws InterruptedException {
        printTestHeader("Concurrent expenses");

        Participant alice = Participant.create("Alice");
        Participant bob = Participant.create("Bob");
        Participant charlie = Participant.create("Charlie");
        Ledger ledger = newLedger(alice, bob, charlie);

        int threadCount = 8;
        int expensesPerThread = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            Participant payer = i % 2 == 0 ? alice : bob;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < expensesPerThread; j++) {
                        ledger.addExpense(payer.getId(), new BigDecimal("30.00"), SplitType.EQUAL);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        int perPayer = threadCount / 2 * expensesPerThread;
        assertEquals(threadCount * expensesPerThread, ledger.getExpenses().size());
        assertEquals(new BigDecimal(perPayer * 10).setScale(2),
            ledger.getOutstanding(charlie.getId(), alice.getId()));
        assertEquals(new BigDecimal(perPayer * 10).setScale(2),
            ledger.getOutstanding(bob.getId(), alice.getId()));
        assertEquals(new BigDecimal(perPayer * 10).setScale(2),
            ledger.getOutstanding(alice.getId(), bob.getId()));
        assertTrue(ledger.isBalanced());
    }

    @Test
    @DisplayName("Concurrent settlements of one debt never overshoot it")
    void testConcurrentSettlements() throws InterruptedException {
        printTestHeader("Concurrent settlements");

        Participant alice = Participant.create("Alice");
        Participant bob = Participant.create("Bob");
        Ledger ledger = newLedger(alice, bob);
        ledger.addExpense(alice.getId(), new BigDecimal("200.00"), SplitType.EXACT,
            Map.of(bob.getId(), new BigDecimal("100.00"), alice.getId(), new BigDecimal("100.00")));

        int threadCount = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledger.settle(bob.getId(), alice.getId(), new BigDecimal("30.00"));
                    successCount.incrementAndGet();
                } catch (LedgerException e) {
                    rejectedCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("Successful settlements: " + successCount.get());
        System.out.println("Rejected settlements: " + rejectedCount.get());

        assertEquals(3, successCount.get());
        assertEquals(threadCount - 3, rejectedCount.get());
        assertEquals(new BigDecimal("10.00"), ledger.getOutstanding(bob.getId(), alice.getId()));
        assertEquals(3, ledger.getSettlements().size());
        assertTrue(ledger.isBalanced());
    }
}
