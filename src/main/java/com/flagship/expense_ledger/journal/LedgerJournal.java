package com.flagship.expense_ledger.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_ledger.event.LedgerEvent;
import com.flagship.expense_ledger.ledger.LedgerEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, in-memory journal of ledger events.
 *
 * Every committed ledger change is written here as a JSON entry, in commit order.
 * This is the hand-off point for anything that wants to store or forward ledger
 * history; the journal itself keeps entries only for the life of the process.
 */
@Component
@Slf4j
public class LedgerJournal implements LedgerEventSink {

    public static final String AGGREGATE_TYPE = "Ledger";

    private final ObjectMapper objectMapper;
    private final List<JournalEntry> entries = new ArrayList<>();

    public LedgerJournal(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(LedgerEvent event) {
        append(event);
    }

    /**
     * Serializes an event and appends it to the journal.
     *
     * @param event Event to record
     * @return The stored entry
     */
    public synchronized JournalEntry append(LedgerEvent event) {
        String jsonPayload = serializePayload(event);

        JournalEntry entry = JournalEntry.create(
            AGGREGATE_TYPE, event.getLedgerId(), event.getEventType(), jsonPayload, entries.size() + 1L);
        entries.add(entry);

        log.debug("Journaled event: type={}, ledgerId={}, sequence={}",
            event.getEventType(), event.getLedgerId(), entry.getSequenceNumber());

        return entry;
    }

    /**
     * Entries for one ledger, oldest first.
     */
    public synchronized List<JournalEntry> getEntriesForLedger(String ledgerId) {
        return entries.stream()
            .filter(entry -> entry.getAggregateId().equals(ledgerId))
            .toList();
    }

    public synchronized List<JournalEntry> getEntries() {
        return List.copyOf(entries);
    }

    public synchronized long count() {
        return entries.size();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
