package com.taxledger.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Result of a EUR conversion: the converted amount with the date of the rate used, or UNKNOWN.
 */
public final class ConversionResult {

    private static final ConversionResult UNKNOWN = new ConversionResult(null, null);

    private final BigDecimal amountEur;
    private final LocalDate rateDate;

    private ConversionResult(BigDecimal amountEur, LocalDate rateDate) {
        this.amountEur = amountEur;
        this.rateDate = rateDate;
    }

    public static ConversionResult known(BigDecimal amountEur, LocalDate rateDate) {
        if (amountEur == null) {
            return UNKNOWN;
        }
        return new ConversionResult(amountEur, rateDate);
    }

    public static ConversionResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return amountEur == null;
    }

    public Optional<BigDecimal> getAmountEur() {
        return Optional.ofNullable(amountEur);
    }

    /** Date of the rate actually applied; null for EUR pass-through and zero amounts. */
    public Optional<LocalDate> getRateDate() {
        return Optional.ofNullable(rateDate);
    }

    /** Converted amount, or {@code fallback} when the conversion failed. */
    public BigDecimal orElse(BigDecimal fallback) {
        return amountEur != null ? amountEur : fallback;
    }
}
