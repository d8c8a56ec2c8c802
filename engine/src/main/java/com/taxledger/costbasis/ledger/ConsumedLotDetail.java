package com.taxledger.costbasis.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Slice of an option lot closed by exercise, assignment or expiration. {@code valuePerUnitEur} is the premium paid
 * (long) or received (short) per contract.
 */
public record ConsumedLotDetail(
        BigDecimal quantity,
        BigDecimal valuePerUnitEur,
        LocalDate lotDate,
        String sourceTransactionId
) {
}
