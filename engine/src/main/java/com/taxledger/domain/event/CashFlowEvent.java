package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Dividend, fund distribution, interest, Stückzinsen or capital repayment.
 */
@Builder
public record CashFlowEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        FinancialEventType type,
        String transactionId,
        String description,
        BigDecimal grossAmountForeign,
        String currency,
        BigDecimal grossAmountEur,
        String sourceCountry
) implements FinancialEvent {

    public CashFlowEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (!type.isCashFlow()) {
            throw new IllegalArgumentException("Not a cash flow type: " + type);
        }
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitCashFlow(this);
    }
}
