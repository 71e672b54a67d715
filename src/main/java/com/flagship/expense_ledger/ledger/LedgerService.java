package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.ledger.exception.LedgerException;
import com.flagship.expense_ledger.ledger.exception.UnknownLedgerException;
import com.flagship.expense_ledger.ledger.exception.UnknownParticipantException;
import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.settlement.SettlementPolicy;
import com.flagship.expense_ledger.settlement.SettlementPolicyRegistry;
import com.flagship.expense_ledger.split.SplitPolicy;
import com.flagship.expense_ledger.split.SplitPolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for callers of the ledger core.
 *
 * Creates participants and ledgers, keeps them in memory by id, and runs ledger
 * operations with the ledger id in the logging context and metrics around them.
 * Ledger errors are logged and rethrown unchanged.
 *
 * A participant belongs to at most one ledger: its balances are guarded by that
 * ledger's lock, so sharing it between ledgers is rejected.
 */
@Service
@Slf4j
public class LedgerService {

    public static final String LEDGER_ID_MDC_KEY = "ledgerId";

    private final SplitPolicyRegistry splitPolicies;
    private final SettlementPolicyRegistry settlementPolicies;
    private final LedgerEventSink eventSink;
    private final LedgerMetrics ledgerMetrics;
    private final CurrencyCode defaultCurrency;
    private final String defaultSettlementPolicy;

    private final Map<String, Participant> participants = new ConcurrentHashMap<>();
    private final Map<String, Ledger> ledgers = new ConcurrentHashMap<>();
    private final Map<String, String> ledgerByParticipant = new ConcurrentHashMap<>();

    public LedgerService(SplitPolicyRegistry splitPolicies,
                         SettlementPolicyRegistry settlementPolicies,
                         LedgerEventSink eventSink,
                         LedgerMetrics ledgerMetrics,
                         @Value("${ledger.default-currency:INR}") CurrencyCode defaultCurrency,
                         @Value("${ledger.default-settlement-policy:DIRECT_PAIRWISE}") String defaultSettlementPolicy) {
        this.splitPolicies = splitPolicies;
        this.settlementPolicies = settlementPolicies;
        this.eventSink = eventSink;
        this.ledgerMetrics = ledgerMetrics;
        this.defaultCurrency = defaultCurrency;
        this.defaultSettlementPolicy = defaultSettlementPolicy;

        ledgerMetrics.registerLedgerCountGauge(ledgers::size);
    }

    /**
     * Creates a participant with a new, unique id.
     */
    public Participant createParticipant(String name) {
        Participant participant = Participant.create(name);
        participants.put(participant.getId(), participant);
        ledgerMetrics.incrementParticipantsCreated();

        log.info("Participant created: participantId={}, name={}", participant.getId(), participant.getName());
        return participant;
    }

    /**
     * @throws UnknownParticipantException if no participant has this id
     */
    public Participant getParticipant(String participantId) {
        Participant participant = participantId == null ? null : participants.get(participantId);
        if (participant == null) {
            throw new UnknownParticipantException(participantId);
        }
        return participant;
    }

    public Ledger createLedger(String name, List<String> participantIds) {
        return createLedger(name, participantIds, defaultSettlementPolicy, defaultCurrency);
    }

    public Ledger createLedger(String name, List<String> participantIds, String settlementPolicy) {
        return createLedger(name, participantIds, settlementPolicy, defaultCurrency);
    }

    /**
     * Creates a ledger over existing participants.
     *
     * @param name Ledger name
     * @param participantIds Members, in ledger order
     * @param settlementPolicy Registered settlement policy key, fixed for the ledger's life
     * @param currency Currency of every amount in the ledger
     * @return The new ledger
     * @throws com.flagship.expense_ledger.ledger.exception.UnknownSettlementPolicyException if the key is unknown
     * @throws UnknownParticipantException if a participant id is unknown
     * @throws IllegalStateException if a participant already belongs to another ledger
     */
    public synchronized Ledger createLedger(String name, List<String> participantIds, String settlementPolicy,
                                            CurrencyCode currency) {
        SettlementPolicy policy = settlementPolicies.resolve(settlementPolicy);
        if (participantIds == null) {
            throw new IllegalArgumentException("Participant ids are required");
        }

        List<Participant> members = new ArrayList<>();
        for (String participantId : participantIds) {
            Participant participant = getParticipant(participantId);
            String existingLedgerId = ledgerByParticipant.get(participantId);
            if (existingLedgerId != null) {
                throw new IllegalStateException(String.format(
                    "Participant %s already belongs to ledger %s", participantId, existingLedgerId));
            }
            members.add(participant);
        }

        Ledger ledger = Ledger.create(name, members, currency, policy, splitPolicies, eventSink);
        ledgers.put(ledger.getId(), ledger);
        members.forEach(member -> ledgerByParticipant.put(member.getId(), ledger.getId()));
        ledgerMetrics.recordLedgerCreated(policy.getKey());

        log.info("Ledger created: ledgerId={}, name={}, participants={}, settlementPolicy={}, currency={}",
            ledger.getId(), name, members.size(), policy.getKey(), currency);
        return ledger;
    }

    /**
     * @throws UnknownLedgerException if no ledger has this id
     */
    public Ledger getLedger(String ledgerId) {
        Ledger ledger = ledgerId == null ? null : ledgers.get(ledgerId);
        if (ledger == null) {
            throw new UnknownLedgerException(ledgerId);
        }
        return ledger;
    }

    public List<Ledger> getLedgers() {
        return List.copyOf(ledgers.values());
    }

    /**
     * Adds an expense to a ledger. See {@link Ledger#addExpense(String, BigDecimal, String, Map, String)}.
     */
    public Expense addExpense(String ledgerId, String payerId, BigDecimal amount, String splitType,
                              Map<String, BigDecimal> customShares, String description) {
        long startTime = System.currentTimeMillis();
        MDC.put(LEDGER_ID_MDC_KEY, ledgerId);

        try {
            Ledger ledger = getLedger(ledgerId);
            Expense expense = ledger.addExpense(payerId, amount, splitType, customShares, description);

            ledgerMetrics.recordExpense(expense.getSplitType(), LedgerMetrics.STATUS_SUCCESS);
            log.info("Expense added: expenseId={}, payer={}, amount={}, splitType={}",
                expense.getId(), payerId, expense.getAmount(), expense.getSplitType());
            return expense;

        } catch (LedgerException e) {
            ledgerMetrics.recordExpense(splitType, LedgerMetrics.STATUS_REJECTED);
            log.warn("Expense rejected: payer={}, amount={}, splitType={}, reason={}",
                payerId, amount, splitType, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency("add_expense", System.currentTimeMillis() - startTime);
            MDC.remove(LEDGER_ID_MDC_KEY);
        }
    }

    /**
     * Records a repayment in a ledger. See {@link Ledger#settle(String, String, BigDecimal)}.
     */
    public Settlement settle(String ledgerId, String payerId, String payeeId, BigDecimal amount) {
        long startTime = System.currentTimeMillis();
        MDC.put(LEDGER_ID_MDC_KEY, ledgerId);
        String policy = "unknown";

        try {
            Ledger ledger = getLedger(ledgerId);
            policy = ledger.getSettlementPolicyKey();
            Settlement settlement = ledger.settle(payerId, payeeId, amount);

            ledgerMetrics.recordSettlement(policy, LedgerMetrics.STATUS_SUCCESS);
            log.info("Debt settled: settlementId={}, payer={}, payee={}, amount={}",
                settlement.getId(), payerId, payeeId, settlement.getAmount());
            return settlement;

        } catch (LedgerException e) {
            ledgerMetrics.recordSettlement(policy, LedgerMetrics.STATUS_REJECTED);
            log.warn("Settlement rejected: payer={}, payee={}, amount={}, reason={}",
                payerId, payeeId, amount, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency("settle", System.currentTimeMillis() - startTime);
            MDC.remove(LEDGER_ID_MDC_KEY);
        }
    }

    public Map<String, Map<String, BigDecimal>> getPassbook(String ledgerId) {
        return getLedger(ledgerId).getPassbook();
    }

    /**
     * Makes an additional split policy available to every ledger under {@code key}.
     */
    public void registerSplitPolicy(String key, SplitPolicy policy) {
        splitPolicies.register(key, policy);
        log.info("Split policy registered: key={}", key);
    }

    /**
     * Makes an additional settlement policy available to ledgers created from now on.
     */
    public void registerSettlementPolicy(String key, SettlementPolicy policy) {
        settlementPolicies.register(key, policy);
        log.info("Settlement policy registered: key={}", key);
    }
}
