package com.flagship.expense_ledger.split;

import com.flagship.expense_ledger.ledger.exception.MissingCustomSharesException;
import com.flagship.expense_ledger.ledger.exception.PercentageSumMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PercentageSplitPolicyTest {

    private final PercentageSplitPolicy policy = new PercentageSplitPolicy();
    private final List<String> participants = List.of("alice", "bob", "charlie");

    @Test
    @DisplayName("40/40/20 of 500 gives 200/200/100")
    void testPercentageSplit() {
        Map<String, BigDecimal> shares = policy.split("charlie", new BigDecimal("500.00"), participants,
            Map.of("alice", new BigDecimal("40"), "bob", new BigDecimal("40"), "charlie", new BigDecimal("20")));

        assertEquals(new BigDecimal("200.00"), shares.get("alice"));
        assertEquals(new BigDecimal("200.00"), shares.get("bob"));
        assertEquals(new BigDecimal("100.00"), shares.get("charlie"));
    }

    @Test
    @DisplayName("Rounding leftovers are handed back so shares add up exactly")
    void testRoundingLeftover() {
        Map<String, BigDecimal> shares = policy.split("alice", new BigDecimal("10.00"), participants,
            Map.of("alice", new BigDecimal("33.33"), "bob", new BigDecimal("33.33"),
                "charlie", new BigDecimal("33.34")));

        assertEquals(new BigDecimal("3.34"), shares.get("alice"));
        assertEquals(new BigDecimal("3.33"), shares.get("bob"));
        assertEquals(new BigDecimal("3.33"), shares.get("charlie"));
        assertEquals(new BigDecimal("10.00"), shares.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Test
    @DisplayName("Zero percent participants never receive leftover units")
    void testZeroPercentNotRounded() {
        Map<String, BigDecimal> shares = policy.split("alice", new BigDecimal("0.05"), participants,
            Map.of("alice", new BigDecimal("0"), "bob", new BigDecimal("50"), "charlie", new BigDecimal("50")));

        assertEquals(new BigDecimal("0.00"), shares.get("alice"));
        assertEquals(new BigDecimal("0.03"), shares.get("bob"));
        assertEquals(new BigDecimal("0.02"), shares.get("charlie"));
    }

    @Test
    @DisplayName("Percentages must add up to exactly 100")
    void testPercentageSumMismatch() {
        PercentageSumMismatchException e = assertThrows(PercentageSumMismatchException.class,
            () -> policy.split("alice", new BigDecimal("100.00"), participants,
                Map.of("alice", new BigDecimal("50"), "bob", new BigDecimal("49.9"))));

        assertEquals(0, new BigDecimal("99.9").compareTo(e.getPercentageTotal()));
    }

    @Test
    @DisplayName("Percentage split without percentages is rejected")
    void testMissingShares() {
        assertThrows(MissingCustomSharesException.class,
            () -> policy.split("alice", new BigDecimal("100.00"), participants, null));
    }
}
