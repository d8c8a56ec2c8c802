package com.taxledger.domain.event;

/**
 * Visitor for callers that handle a subset of kinds; everything else goes to {@link #otherwise(FinancialEvent)}.
 */
public abstract class DefaultFinancialEventVisitor<R> implements FinancialEventVisitor<R> {

    protected abstract R otherwise(FinancialEvent event);

    @Override
    public R visitTrade(TradeEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitCashFlow(CashFlowEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitWithholdingTax(WithholdingTaxEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitFee(FeeEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitCurrencyConversion(CurrencyConversionEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitSplit(SplitEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitCashMerger(CashMergerEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitStockMerger(StockMergerEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitStockDividend(StockDividendEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitExpireDividendRights(ExpireDividendRightsEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitOptionExercise(OptionExerciseEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitOptionAssignment(OptionAssignmentEvent event) {
        return otherwise(event);
    }

    @Override
    public R visitOptionExpiration(OptionExpirationEvent event) {
        return otherwise(event);
    }
}
