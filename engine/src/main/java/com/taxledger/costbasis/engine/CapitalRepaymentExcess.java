package com.taxledger.costbasis.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** Part of a capital repayment that exceeded the remaining cost basis; taxed as ordinary capital income. */
public record CapitalRepaymentExcess(UUID eventId, UUID assetId, LocalDate eventDate, BigDecimal amountEur) {
}
