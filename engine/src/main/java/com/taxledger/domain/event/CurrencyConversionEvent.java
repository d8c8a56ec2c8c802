package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * FX trade between two cash balances. Ordered with trades; produces no realized result in this engine.
 */
@Builder
public record CurrencyConversionEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String fromCurrency,
        BigDecimal fromAmount,
        String toCurrency,
        BigDecimal toAmount,
        BigDecimal exchangeRate,
        BigDecimal grossAmountEur
) implements FinancialEvent {

    public CurrencyConversionEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CURRENCY_CONVERSION;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitCurrencyConversion(this);
    }
}
