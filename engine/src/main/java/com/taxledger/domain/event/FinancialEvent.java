package com.taxledger.domain.event;

import com.taxledger.domain.FinancialEventType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Closed set of parsed broker events. New kinds must be added to {@link FinancialEventVisitor}, so every dispatcher
 * fails to compile until it handles them.
 */
public sealed interface FinancialEvent
        permits TradeEvent, CashFlowEvent, WithholdingTaxEvent, FeeEvent, CurrencyConversionEvent,
        CorporateActionEvent, OptionLifecycleEvent {

    UUID eventId();

    UUID assetId();

    LocalDate eventDate();

    FinancialEventType type();

    /** Broker-assigned transaction id; may be null. */
    String transactionId();

    String description();

    /** Monetary amount in EUR; may be null when the event carries none. */
    BigDecimal grossAmountEur();

    <R> R accept(FinancialEventVisitor<R> visitor);
}
