package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Forward (or reverse) split: every lot's quantity is multiplied by {@code newSharesPerOldShare}.
 */
@Builder
public record SplitEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String corporateActionId,
        BigDecimal grossAmountEur,
        BigDecimal newSharesPerOldShare
) implements CorporateActionEvent {

    public SplitEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CORP_SPLIT_FORWARD;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitSplit(this);
    }
}
