package com.taxledger.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Converts foreign-currency amounts to EUR. Failures are returned as {@link ConversionResult#unknown()}, never thrown;
 * callers degrade to a zero value and log.
 */
public interface CurrencyConverter {

    ConversionResult convertToEur(BigDecimal amount, String currency, LocalDate date);
}
