package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Share-for-share exchange into {@code newAssetId}.
 */
@Builder
public record StockMergerEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String corporateActionId,
        BigDecimal grossAmountEur,
        UUID newAssetId,
        BigDecimal ratio
) implements CorporateActionEvent {

    public StockMergerEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CORP_MERGER_STOCK;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitStockMerger(this);
    }
}
