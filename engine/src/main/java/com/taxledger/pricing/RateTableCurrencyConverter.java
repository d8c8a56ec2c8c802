package com.taxledger.pricing;

import com.taxledger.common.NumericContext;
import com.taxledger.pricing.config.FxProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * EUR conversion with reference rates. EUR passes through unchanged and zero converts to zero; otherwise
 * EUR = amount / rate, using the latest rate published at most {@code maxFallbackDays} before the requested date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateTableCurrencyConverter implements CurrencyConverter {

    private static final String EUR = "EUR";

    private final ExchangeRateLookup exchangeRateLookup;
    private final FxProperties fxProperties;
    private final NumericContext numericContext;

    @Override
    public ConversionResult convertToEur(BigDecimal amount, String currency, LocalDate date) {
        if (amount == null) {
            return ConversionResult.unknown();
        }
        if (currency == null || currency.isBlank()) {
            log.warn("Cannot convert {} to EUR on {}: currency missing", amount, date);
            return ConversionResult.unknown();
        }
        if (amount.signum() == 0) {
            return ConversionResult.known(BigDecimal.ZERO, null);
        }
        String code = currency.strip().toUpperCase(Locale.ROOT);
        if (EUR.equals(code)) {
            return ConversionResult.known(amount, null);
        }
        if (date == null) {
            log.warn("Cannot convert {} {} to EUR: date missing", amount, code);
            return ConversionResult.unknown();
        }
        for (int back = 0; back <= fxProperties.getMaxFallbackDays(); back++) {
            LocalDate candidate = date.minusDays(back);
            Optional<BigDecimal> rate = exchangeRateLookup.rateOn(code, candidate);
            if (rate.isEmpty()) {
                continue;
            }
            if (rate.get().signum() <= 0) {
                log.error("Non-positive {} rate {} on {}; conversion of {} failed", code, rate.get(), candidate, amount);
                return ConversionResult.unknown();
            }
            if (back > 0) {
                log.debug("Using {} rate from {} for {} (fallback {} days)", code, candidate, date, back);
            }
            return ConversionResult.known(numericContext.divide(amount, rate.get()), candidate);
        }
        log.warn("No {} rate within {} days before {}; conversion of {} failed",
                code, fxProperties.getMaxFallbackDays(), date, amount);
        return ConversionResult.unknown();
    }
}
