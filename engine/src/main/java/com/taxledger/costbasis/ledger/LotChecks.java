package com.taxledger.costbasis.ledger;

import java.math.BigDecimal;

final class LotChecks {

    private LotChecks() {
    }

    static void requirePositive(BigDecimal value, String what) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(what + " must be positive, got: " + value);
        }
    }

    static void requireNonNegative(BigDecimal value, String what) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(what + " must be non-negative, got: " + value);
        }
    }

    static String requireSourceId(String sourceTransactionId) {
        if (sourceTransactionId == null || sourceTransactionId.isBlank()) {
            throw new IllegalArgumentException("lot requires a non-empty source transaction id");
        }
        return sourceTransactionId;
    }
}
