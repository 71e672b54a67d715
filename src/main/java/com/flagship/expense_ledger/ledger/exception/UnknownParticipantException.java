package com.flagship.expense_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when a participant id is not known, or is not a member of the ledger being used.
 */
@Getter
public class UnknownParticipantException extends LedgerException {

    private final String participantId;

    public UnknownParticipantException(String participantId) {
        super("Participant not found: " + participantId);
        this.participantId = participantId;
    }
}
