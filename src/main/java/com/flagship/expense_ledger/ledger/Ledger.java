package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.event.DebtSettledEvent;
import com.flagship.expense_ledger.event.ExpenseAddedEvent;
import com.flagship.expense_ledger.event.LedgerEvent;
import com.flagship.expense_ledger.ledger.exception.InvalidAmountException;
import com.flagship.expense_ledger.ledger.exception.UnknownParticipantException;
import com.flagship.expense_ledger.settlement.DebtSimplifier;
import com.flagship.expense_ledger.settlement.SettlementPolicy;
import com.flagship.expense_ledger.settlement.SuggestedTransfer;
import com.flagship.expense_ledger.split.SplitPolicy;
import com.flagship.expense_ledger.split.SplitPolicyRegistry;
import com.flagship.expense_ledger.split.SplitType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A group of participants sharing expenses, and the authority on who owes whom.
 *
 * This aggregate enforces the core invariants:
 * 1. Every expense's shares add up to its amount
 * 2. No recorded debt is ever negative
 * 3. Participant balances across the ledger always sum to zero
 * 4. A rejected operation leaves the ledger exactly as it was
 *
 * {@link #addExpense} and {@link #settle} each run as one transaction under the
 * ledger's write lock. Everything they need to validate is checked before the
 * lock is taken and before anything is changed. Reads take the read lock and
 * return snapshots.
 *
 * Participants and the settlement policy are fixed when the ledger is created.
 */
@Slf4j
public class Ledger {

    @Getter
    private final String id;
    @Getter
    private final String name;
    @Getter
    private final CurrencyCode currency;

    private final Map<String, Participant> participants;
    private final List<String> participantIds;
    private final List<Expense> expenses = new ArrayList<>();
    private final List<Settlement> settlements = new ArrayList<>();
    private final BalanceSheet balanceSheet = new BalanceSheet();

    private final SettlementPolicy settlementPolicy;
    private final SplitPolicyRegistry splitPolicies;
    private final LedgerEventSink eventSink;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Ledger(String id, String name, CurrencyCode currency, Map<String, Participant> participants,
                   SettlementPolicy settlementPolicy, SplitPolicyRegistry splitPolicies,
                   LedgerEventSink eventSink) {
        this.id = id;
        this.name = name;
        this.currency = currency;
        this.participants = Collections.unmodifiableMap(participants);
        this.participantIds = List.copyOf(participants.keySet());
        this.settlementPolicy = settlementPolicy;
        this.splitPolicies = splitPolicies;
        this.eventSink = eventSink;
    }

    /**
     * Creates a ledger over a fixed set of participants.
     *
     * @param name Ledger name, e.g. "Goa Trip"
     * @param participants Members, in the order used for every deterministic iteration
     * @param currency Currency all amounts are recorded in
     * @param settlementPolicy Policy used by every {@link #settle} call
     * @param splitPolicies Registry consulted by {@link #addExpense}
     * @param eventSink Receives an event for each committed change
     * @throws IllegalArgumentException if the name is blank, there are no participants,
     *         or a participant appears twice
     */
    public static Ledger create(String name, List<Participant> participants, CurrencyCode currency,
                                SettlementPolicy settlementPolicy, SplitPolicyRegistry splitPolicies,
                                LedgerEventSink eventSink) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Ledger name is required");
        }
        if (participants == null || participants.isEmpty()) {
            throw new IllegalArgumentException("A ledger needs at least one participant");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (settlementPolicy == null || splitPolicies == null) {
            throw new IllegalArgumentException("Split and settlement policies are required");
        }

        Map<String, Participant> members = new LinkedHashMap<>();
        for (Participant participant : participants) {
            if (members.putIfAbsent(participant.getId(), participant) != null) {
                throw new IllegalArgumentException("Participant listed twice: " + participant.getId());
            }
        }

        return new Ledger(UUID.randomUUID().toString(), name, currency, members, settlementPolicy,
            splitPolicies, eventSink == null ? LedgerEventSink.NONE : eventSink);
    }

    public Expense addExpense(String payerId, BigDecimal amount, SplitType splitType) {
        return addExpense(payerId, amount, splitType.key(), null, "");
    }

    public Expense addExpense(String payerId, BigDecimal amount, SplitType splitType,
                              Map<String, BigDecimal> customShares) {
        return addExpense(payerId, amount, splitType.key(), customShares, "");
    }

    /**
     * Records an expense and updates balances.
     *
     * This method:
     * 1. Resolves the split policy by key
     * 2. Validates payer and amount
     * 3. Computes the split
     * 4. Applies the split to participant balances
     * 5. Adds each non-payer share to what that participant owes the payer
     *
     * Steps 1-3 may fail; steps 4-5 run only once everything has validated.
     *
     * @param payerId Participant who paid
     * @param amount Positive amount, at most as precise as the currency's minor unit
     * @param splitType Registered split key, e.g. {@code EQUAL}
     * @param customShares Amounts (EXACT) or percentages (PERCENTAGE) per participant, may be null
     * @param description Free text, may be null
     * @return The recorded expense
     */
    public Expense addExpense(String payerId, BigDecimal amount, String splitType,
                              Map<String, BigDecimal> customShares, String description) {
        SplitPolicy splitPolicy = splitPolicies.resolve(splitType);
        requireParticipant(payerId);
        BigDecimal normalizedAmount = requirePositive(amount);

        Map<String, BigDecimal> splits = validateSplits(splitPolicy,
            splitPolicy.split(payerId, normalizedAmount, participantIds, customShares));
        Expense expense = Expense.create(id, payerId, normalizedAmount, splitPolicy.getKey(), splits, description);

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            expense.applyTo(participants);
            expenses.add(expense);
            expense.getOwedShares().forEach((participantId, share) ->
                balanceSheet.increase(participantId, payerId, share));

            log.debug("Applied expense: expenseId={}, payer={}, amount={}, splitType={}",
                expense.getId(), payerId, normalizedAmount, splitPolicy.getKey());

            publish(ExpenseAddedEvent.fromExpense(expense, currency.name()));
        } finally {
            writeLock.unlock();
        }
        return expense;
    }

    /**
     * Records a repayment from {@code payerId} to {@code payeeId} through the ledger's
     * settlement policy. Policy errors propagate unchanged.
     *
     * @return The recorded settlement
     */
    public Settlement settle(String payerId, String payeeId, BigDecimal amount) {
        Participant payer = requireParticipant(payerId);
        Participant payee = requireParticipant(payeeId);
        BigDecimal normalizedAmount = requirePositive(amount);

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            settlementPolicy.settle(payer, payee, normalizedAmount, balanceSheet);

            Settlement settlement = Settlement.create(id, payerId, payeeId, normalizedAmount,
                settlementPolicy.getKey());
            settlements.add(settlement);
            BigDecimal remaining = balanceSheet.getOutstanding(payerId, payeeId);

            log.debug("Applied settlement: settlementId={}, payer={}, payee={}, amount={}, remaining={}",
                settlement.getId(), payerId, payeeId, normalizedAmount, remaining);

            publish(DebtSettledEvent.fromSettlement(settlement, remaining, currency.name()));
            return settlement;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Snapshot of the balance sheet: debtor id -> creditor id -> amount owed.
     * Only non-zero debts appear. Changing the ledger later does not change the snapshot.
     */
    public Map<String, Map<String, BigDecimal>> getPassbook() {
        return read(balanceSheet::snapshot);
    }

    /**
     * Amount {@code debtorId} currently owes {@code creditorId}, zero if nothing.
     */
    public BigDecimal getOutstanding(String debtorId, String creditorId) {
        return read(() -> balanceSheet.getOutstanding(debtorId, creditorId));
    }

    public List<Expense> getExpenses() {
        return read(() -> List.copyOf(expenses));
    }

    public List<Settlement> getSettlements() {
        return read(() -> List.copyOf(settlements));
    }

    public List<Participant> getParticipants() {
        return List.copyOf(participants.values());
    }

    public List<String> getParticipantIds() {
        return participantIds;
    }

    /**
     * @throws UnknownParticipantException if the participant is not a member of this ledger
     */
    public Participant getParticipant(String participantId) {
        return requireParticipant(participantId);
    }

    /**
     * Net balance of a participant: positive when others owe them overall.
     */
    public BigDecimal getNetBalance(String participantId) {
        Participant participant = requireParticipant(participantId);
        return read(participant::getNetBalance);
    }

    /**
     * Checks conservation: participant balances add up to zero.
     */
    public boolean isBalanced() {
        return read(() -> participants.values().stream()
            .map(Participant::getNetBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .signum() == 0);
    }

    /**
     * Transfers that would clear every debt in the ledger with few payments.
     * Read-only: nothing is settled.
     */
    public List<SuggestedTransfer> suggestSettlements() {
        Map<String, Map<String, BigDecimal>> passbook = getPassbook();
        return DebtSimplifier.simplify(DebtSimplifier.netPositions(participantIds, passbook));
    }

    public String getSettlementPolicyKey() {
        return settlementPolicy.getKey();
    }

    private <T> T read(Supplier<T> reader) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return reader.get();
        } finally {
            readLock.unlock();
        }
    }

    private Participant requireParticipant(String participantId) {
        Participant participant = participantId == null ? null : participants.get(participantId);
        if (participant == null) {
            throw new UnknownParticipantException(participantId);
        }
        return participant;
    }

    private BigDecimal requirePositive(BigDecimal amount) {
        BigDecimal normalized = currency.normalize(amount);
        if (normalized.signum() <= 0) {
            throw new InvalidAmountException("Amount must be positive: " + amount);
        }
        return normalized;
    }

    /**
     * Checks a policy's shares and brings them to the currency's scale.
     *
     * @throws InvalidAmountException if a share is finer than the currency's minor unit
     */
    private Map<String, BigDecimal> validateSplits(SplitPolicy splitPolicy, Map<String, BigDecimal> splits) {
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        splits.forEach((participantId, share) -> {
            if (!participants.containsKey(participantId)) {
                throw new IllegalStateException(String.format(
                    "Split policy %s returned a share for a non-member: %s", splitPolicy.getKey(), participantId));
            }
            if (share == null || share.signum() < 0) {
                throw new IllegalStateException(String.format(
                    "Split policy %s returned an invalid share for %s: %s",
                    splitPolicy.getKey(), participantId, share));
            }
            normalized.put(participantId, currency.normalize(share));
        });
        return normalized;
    }

    /**
     * Hands an applied change to the sink. A failing sink is logged; the change stays committed.
     */
    private void publish(LedgerEvent event) {
        try {
            eventSink.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish ledger event: ledgerId={}, eventType={}, error={}",
                id, event.getEventType(), e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("Ledger(%s, id=%s)", name, id);
    }
}
