package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Buy/sell of an instrument. {@code quantity} is signed (buy and cover positive, sell and short-open negative);
 * {@code netAmountEur} is cost including commission for buys and proceeds after commission for sells.
 * {@code relatedOptionEventId} links a stock trade to the exercise/assignment that caused it.
 */
@Builder(toBuilder = true)
public record TradeEvent(
        UUID eventId,
        UUID assetId,
        LocalDate eventDate,
        FinancialEventType type,
        String transactionId,
        String description,
        BigDecimal quantity,
        BigDecimal priceForeign,
        BigDecimal grossAmountEur,
        BigDecimal commissionEur,
        BigDecimal netAmountEur,
        UUID relatedOptionEventId
) implements FinancialEvent {

    public TradeEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (!type.isTrade()) {
            throw new IllegalArgumentException("Not a trade type: " + type);
        }
    }

    public TradeEvent withNetAmountEur(BigDecimal adjustedNetAmountEur) {
        return toBuilder().netAmountEur(adjustedNetAmountEur).build();
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visitTrade(this);
    }
}
