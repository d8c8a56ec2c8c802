package com.taxledger.domain.event;

/**
 * Exhaustive dispatch over {@link FinancialEvent} kinds.
 */
public interface FinancialEventVisitor<R> {

    R visitTrade(TradeEvent event);

    R visitCashFlow(CashFlowEvent event);

    R visitWithholdingTax(WithholdingTaxEvent event);

    R visitFee(FeeEvent event);

    R visitCurrencyConversion(CurrencyConversionEvent event);

    R visitSplit(SplitEvent event);

    R visitCashMerger(CashMergerEvent event);

    R visitStockMerger(StockMergerEvent event);

    R visitStockDividend(StockDividendEvent event);

    R visitExpireDividendRights(ExpireDividendRightsEvent event);

    R visitOptionExercise(OptionExerciseEvent event);

    R visitOptionAssignment(OptionAssignmentEvent event);

    R visitOptionExpiration(OptionExpirationEvent event);
}
