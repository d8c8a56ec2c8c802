package com.taxledger.domain;

/**
 * Kind of a financial event as delivered by the broker statement parser.
 */
public enum FinancialEventType {
    TRADE_BUY_LONG,
    TRADE_SELL_LONG,
    TRADE_SELL_SHORT_OPEN,
    TRADE_BUY_SHORT_COVER,
    DIVIDEND_CASH,
    /** Einlagenrückgewähr: reduces cost basis; any excess over the basis is taxable income. */
    CAPITAL_REPAYMENT,
    DISTRIBUTION_FUND,
    INTEREST_RECEIVED,
    /** Accrued interest paid on bond purchase; negative income. */
    INTEREST_PAID_STUECKZINSEN,
    CORP_SPLIT_FORWARD,
    CORP_MERGER_CASH,
    CORP_MERGER_STOCK,
    CORP_STOCK_DIVIDEND,
    CORP_EXPIRE_DIVIDEND_RIGHTS,
    OPTION_EXERCISE,
    OPTION_ASSIGNMENT,
    OPTION_EXPIRATION_WORTHLESS,
    WITHHOLDING_TAX,
    FEE_TRANSACTION,
    CURRENCY_CONVERSION;

    public boolean isTrade() {
        return this == TRADE_BUY_LONG || this == TRADE_SELL_LONG
                || this == TRADE_SELL_SHORT_OPEN || this == TRADE_BUY_SHORT_COVER;
    }

    public boolean isCashFlow() {
        return this == DIVIDEND_CASH || this == CAPITAL_REPAYMENT || this == DISTRIBUTION_FUND
                || this == INTEREST_RECEIVED || this == INTEREST_PAID_STUECKZINSEN;
    }
}
