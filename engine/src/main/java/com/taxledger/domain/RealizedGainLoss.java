package com.taxledger.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * One realized result per consumed lot slice. Immutable once created.
 * Fund-specific fields ({@code fundType}, {@code exemptionRate}, {@code exemptionAmountEur}) are null for other categories;
 * {@code netGainLossEur} equals the gross figure unless a Teilfreistellung applies.
 */
@Builder
public record RealizedGainLoss(
        UUID originatingEventId,
        UUID assetId,
        AssetCategory assetCategory,
        LocalDate acquisitionDate,
        LocalDate realizationDate,
        RealizationType realizationType,
        BigDecimal quantityRealized,
        BigDecimal unitCostBasisEur,
        BigDecimal unitRealizationValueEur,
        BigDecimal totalCostBasisEur,
        BigDecimal totalRealizationValueEur,
        BigDecimal grossGainLossEur,
        Integer holdingPeriodDays,
        TaxReportingCategory taxReportingCategory,
        boolean stillhalterIncome,
        boolean taxableUnderSection23,
        FundType fundType,
        BigDecimal exemptionRate,
        BigDecimal exemptionAmountEur,
        BigDecimal netGainLossEur
) {

    public RealizedGainLoss {
        Objects.requireNonNull(originatingEventId, "originatingEventId must not be null");
        Objects.requireNonNull(assetCategory, "assetCategory must not be null");
        Objects.requireNonNull(realizationType, "realizationType must not be null");
        Objects.requireNonNull(grossGainLossEur, "grossGainLossEur must not be null");
        if (quantityRealized == null || quantityRealized.signum() < 0) {
            throw new IllegalArgumentException("quantityRealized must be non-negative, got: " + quantityRealized);
        }
        if (netGainLossEur == null) {
            netGainLossEur = grossGainLossEur;
        }
    }

    public boolean isGain() {
        return grossGainLossEur.signum() >= 0;
    }
}
