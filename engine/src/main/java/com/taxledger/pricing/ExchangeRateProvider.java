package com.taxledger.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of daily reference rates, quoted as foreign currency units per 1 EUR (ECB convention).
 * Answers for the exact date only; walking back over weekends and holidays is the converter's job.
 */
public interface ExchangeRateProvider {

    Optional<BigDecimal> findRate(String currency, LocalDate date);
}
