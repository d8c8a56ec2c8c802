package com.taxledger.pricing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Cached single-day rate lookup. Uses fxRateCache. Only published rates are cached; a miss is asked again,
 * since the rate table may be filled after the first lookup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateLookup {

    private final ExchangeRateProvider exchangeRateProvider;

    @Cacheable(cacheNames = "fxRateCache", key = "#currency + '-' + #date", unless = "#result == null")
    public Optional<BigDecimal> rateOn(String currency, LocalDate date) {
        Optional<BigDecimal> rate = exchangeRateProvider.findRate(currency, date);
        if (rate.isEmpty()) {
            log.debug("No {} rate published for {}", currency, date);
        }
        return rate;
    }
}
