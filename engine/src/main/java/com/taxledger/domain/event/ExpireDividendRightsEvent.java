package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

@Builder
public record ExpireDividendRightsEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        String corporateActionId,
        BigDecimal grossAmountEur
) implements CorporateActionEvent {

    public ExpireDividendRightsEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.CORP_EXPIRE_DIVIDEND_RIGHTS;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitExpireDividendRights(this);
    }
}
