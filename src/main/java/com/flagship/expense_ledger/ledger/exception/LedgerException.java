package com.flagship.expense_ledger.ledger.exception;

/**
 * Base type for every error the ledger core raises to its callers.
 *
 * Ledger errors are fail-fast: they are thrown synchronously from the call that
 * detects them, before any ledger state has been modified, and are never retried
 * or suppressed internally.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
