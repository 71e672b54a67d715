package com.flagship.expense_ledger.settlement;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Greedy debt simplification.
 * Input: net position per participant. Output: a short list of transfers that clears it.
 *
 * Algorithm:
 * 1. Separate into creditors (net > 0) and debtors (net < 0).
 * 2. Match the largest creditor with the largest debtor; equal amounts are
 *    ordered by the participant's position in the input map.
 * 3. Transfer min(credit, |debt|) and put back whatever is left.
 * 4. Repeat until all nets are zero.
 *
 * Produces at most N-1 transfers. Purely a projection: nothing is settled.
 */
public final class DebtSimplifier {

    private DebtSimplifier() {
    }

    /**
     * Net position per participant from a balance-sheet snapshot.
     *
     * @param participantIds Participants in ledger order; every one appears in the result
     * @param passbook debtor id -> creditor id -> outstanding amount
     * @return participant id -> net (positive = owed money, negative = owes money)
     */
    public static Map<String, BigDecimal> netPositions(List<String> participantIds,
                                                       Map<String, Map<String, BigDecimal>> passbook) {
        Map<String, BigDecimal> net = new LinkedHashMap<>();
        participantIds.forEach(id -> net.put(id, BigDecimal.ZERO));
        passbook.forEach((debtorId, creditors) -> creditors.forEach((creditorId, amount) -> {
            net.merge(creditorId, amount, BigDecimal::add);
            net.merge(debtorId, amount.negate(), BigDecimal::add);
        }));
        return net;
    }

    /**
     * @param netPositions participant id -> net, in a stable order used for tie-breaking
     * @return transfers that bring every net position to zero
     */
    public static List<SuggestedTransfer> simplify(Map<String, BigDecimal> netPositions) {
        Map<String, Integer> order = new HashMap<>();
        netPositions.keySet().forEach(id -> order.put(id, order.size()));

        Comparator<Position> largestFirst = Comparator
            .comparing((Position p) -> p.amount, Comparator.reverseOrder())
            .thenComparing(p -> order.get(p.participantId));
        PriorityQueue<Position> creditors = new PriorityQueue<>(largestFirst);
        PriorityQueue<Position> debtors = new PriorityQueue<>(largestFirst);

        netPositions.forEach((participantId, net) -> {
            if (net.signum() > 0) {
                creditors.add(new Position(participantId, net));
            } else if (net.signum() < 0) {
                debtors.add(new Position(participantId, net.negate()));
            }
        });

        List<SuggestedTransfer> transfers = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Position creditor = creditors.poll();
            Position debtor = debtors.poll();

            BigDecimal transfer = creditor.amount.min(debtor.amount);
            transfers.add(new SuggestedTransfer(debtor.participantId, creditor.participantId, transfer));

            BigDecimal creditLeft = creditor.amount.subtract(transfer);
            BigDecimal debtLeft = debtor.amount.subtract(transfer);
            if (creditLeft.signum() > 0) {
                creditors.add(new Position(creditor.participantId, creditLeft));
            }
            if (debtLeft.signum() > 0) {
                debtors.add(new Position(debtor.participantId, debtLeft));
            }
        }
        return transfers;
    }

    private static final class Position {
        private final String participantId;
        private final BigDecimal amount;

        private Position(String participantId, BigDecimal amount) {
            this.participantId = participantId;
            this.amount = amount;
        }
    }
}
