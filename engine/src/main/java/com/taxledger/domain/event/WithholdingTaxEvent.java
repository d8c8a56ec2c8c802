package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Foreign withholding tax, usually negative, optionally linked to the income event it was withheld from.
 */
@Builder
public record WithholdingTaxEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        String transactionId,
        String description,
        BigDecimal grossAmountEur,
        String sourceCountry,
        UUID taxedIncomeEventId
) implements FinancialEvent {

    public WithholdingTaxEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
    }

    @Override
    public FinancialEventType type() {
        return FinancialEventType.WITHHOLDING_TAX;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitWithholdingTax(this);
    }
}
