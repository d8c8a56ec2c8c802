package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Takeover for cash: all remaining long lots are realized at {@code cashPerShareEur}.
 */
@Builder
public record CashMergerEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String corporateActionId,
        BigDecimal grossAmountEur,
        BigDecimal cashPerShareEur,
        BigDecimal quantityDisposed
) implements CorporateActionEvent {

    public CashMergerEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CORP_MERGER_CASH;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitCashMerger(this);
    }
}
