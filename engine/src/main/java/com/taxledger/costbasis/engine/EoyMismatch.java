package com.taxledger.costbasis.engine;

import java.math.BigDecimal;
import java.util.UUID;

/** Calculated vs. broker-reported end-of-year quantity; {@code reportedQuantity} is null when the broker reported none. */
public record EoyMismatch(UUID assetId, String assetName, BigDecimal calculatedQuantity, BigDecimal reportedQuantity) {

    public BigDecimal difference() {
        return calculatedQuantity.subtract(reportedQuantity != null ? reportedQuantity : BigDecimal.ZERO);
    }
}
