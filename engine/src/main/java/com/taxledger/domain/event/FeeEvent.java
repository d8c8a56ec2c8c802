package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

@Builder
public record FeeEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        BigDecimal grossAmountEur
) implements FinancialEvent {

    public FeeEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.FEE_TRANSACTION;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitFee(this);
    }
}
