package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Writer gets assigned on a short option; the premium received moves into the resulting stock trade.
 */
@Builder
public record OptionAssignmentEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        BigDecimal grossAmountEur,
        BigDecimal quantityContracts
) implements OptionLifecycleEvent {

    public OptionAssignmentEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.OPTION_ASSIGNMENT;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitOptionAssignment(this);
    }
}
