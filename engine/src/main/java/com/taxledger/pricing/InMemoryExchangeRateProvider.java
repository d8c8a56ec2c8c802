package com.taxledger.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate table filled by the statement import. Currency codes are case-insensitive.
 */
public class InMemoryExchangeRateProvider implements ExchangeRateProvider {

    private final Map<String, Map<LocalDate, BigDecimal>> rates = new ConcurrentHashMap<>();

    public InMemoryExchangeRateProvider put(String currency, LocalDate date, BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive for " + currency + " on " + date + ", got: " + rate);
        }
        rates.computeIfAbsent(normalize(currency), c -> new ConcurrentHashMap<>()).put(date, rate);
        return this;
    }

    @Override
    public Optional<BigDecimal> findRate(String currency, LocalDate date) {
        if (currency == null || date == null) {
            return Optional.empty();
        }
        Map<LocalDate, BigDecimal> byDate = rates.get(normalize(currency));
        return byDate == null ? Optional.empty() : Optional.ofNullable(byDate.get(date));
    }

    private static String normalize(String currency) {
        return currency.strip().toUpperCase(Locale.ROOT);
    }
}
