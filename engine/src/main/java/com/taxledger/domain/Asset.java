package com.taxledger.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Resolved instrument as seen by the engine: classification plus the broker-reported start and end of year position.
 * {@code soyQuantity} and {@code eoyQuantity} are signed (negative = short); either may be null when not reported.
 */
@Builder(toBuilder = true)
public record Asset(
        UUID id,
        AssetCategory category,
        String symbol,
        String description,
        String currency,
        BigDecimal multiplier,
        FundType fundType,
        OptionRight optionRight,
        UUID underlyingAssetId,
        BigDecimal soyQuantity,
        BigDecimal soyCostBasisAmount,
        String soyCostBasisCurrency,
        BigDecimal eoyQuantity
) {

    public Asset {
        Objects.requireNonNull(id, "asset id must not be null");
        Objects.requireNonNull(category, "asset category must not be null");
        if (multiplier == null) {
            multiplier = BigDecimal.ONE;
        }
        if (category == AssetCategory.INVESTMENT_FUND) {
            fundType = FundType.orNone(fundType);
        }
    }

    /** Human-readable key for log lines. */
    public String displayName() {
        if (symbol != null && !symbol.isBlank()) {
            return symbol + " (" + category + ")";
        }
        return id + " (" + category + ")";
    }
}
