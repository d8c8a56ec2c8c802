package com.taxledger.domain.event;

/**
 * Corporate action on a held instrument. Processed before any other event kind on the same day.
 */
public sealed interface CorporateActionEvent extends FinancialEvent
        permits SplitEvent, CashMergerEvent, StockMergerEvent, StockDividendEvent, ExpireDividendRightsEvent {

    /** Broker action id grouping the legs of one corporate action; may be null. */
    String corporateActionId();
}
