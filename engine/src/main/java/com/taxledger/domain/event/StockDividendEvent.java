package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * New shares distributed in kind. {@code fmvPerNewShareEur} becomes the unit cost of the new lot and may be zero.
 */
@Builder
public record StockDividendEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String corporateActionId,
        BigDecimal grossAmountEur,
        BigDecimal quantityNewShares,
        BigDecimal fmvPerNewShareEur
) implements CorporateActionEvent {

    public StockDividendEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CORP_STOCK_DIVIDEND;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitStockDividend(this);
    }
}
