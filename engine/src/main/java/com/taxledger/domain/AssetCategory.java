package com.taxledger.domain;

/**
 * Tax-relevant classification of an instrument. Drives realization type and reporting category at consumption time.
 */
public enum AssetCategory {
    STOCK,
    BOND,
    INVESTMENT_FUND,
    OPTION,
    CFD,
    /** Non-security asset taxed under §23 EStG (private sale within the speculation period). */
    PRIVATE_SALE_ASSET,
    CASH_BALANCE,
    UNKNOWN;

    /** Cash balances never get a FIFO ledger. */
    public boolean isLedgerBearing() {
        return this != CASH_BALANCE;
    }
}
