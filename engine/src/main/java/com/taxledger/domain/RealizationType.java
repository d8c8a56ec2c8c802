package com.taxledger.domain;

/**
 * How a lot slice was closed.
 */
public enum RealizationType {
    LONG_POSITION_SALE,
    SHORT_POSITION_COVER,
    CASH_MERGER_PROCEEDS,
    OPTION_EXPIRED_LONG,
    OPTION_EXPIRED_SHORT,
    OPTION_TRADE_CLOSE_LONG,
    OPTION_TRADE_CLOSE_SHORT
}
