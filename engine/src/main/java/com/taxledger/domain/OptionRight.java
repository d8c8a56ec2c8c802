package com.taxledger.domain;

/**
 * Call or put. Decides the sign of the premium adjustment applied to the underlying stock trade.
 */
public enum OptionRight {
    CALL,
    PUT
}
