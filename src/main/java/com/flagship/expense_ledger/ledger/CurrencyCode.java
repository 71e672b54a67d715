package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Each ledger records amounts in exactly one currency. Amounts are fixed-point
 * values in the currency's minor units, so every sum and comparison is exact.
 */
public enum CurrencyCode {
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    JPY(0); // Japanese Yen

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    /**
     * Number of fractional digits of the currency's minor unit.
     */
    public int getMinorUnits() {
        return minorUnits;
    }

    /**
     * The value of one minor unit (0.01 for USD, 1 for JPY).
     */
    public BigDecimal getMinorUnit() {
        return BigDecimal.ONE.movePointLeft(minorUnits);
    }

    /**
     * Brings an amount to this currency's scale.
     *
     * @param amount Amount to normalize
     * @return The same value with exactly {@link #getMinorUnits()} fractional digits
     * @throws InvalidAmountException if the amount is more precise than one minor unit
     */
    public BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("Amount is required");
        }
        try {
            return amount.setScale(minorUnits, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                String.format("Amount %s has more than %d decimal places for %s", amount, minorUnits, name()), e);
        }
    }
}
