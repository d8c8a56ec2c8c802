package com.taxledger.domain;

import com.taxledger.common.NumericContext;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * Advance lump-sum taxation of a fund for one year, already computed upstream, with its Teilfreistellung applied.
 */
public record VorabpauschaleItem(
        UUID assetId,
        int taxYear,
        FundType fundType,
        BigDecimal grossAmountEur,
        BigDecimal exemptionRate,
        BigDecimal exemptionAmountEur,
        BigDecimal netAmountEur
) {

    public VorabpauschaleItem {
        Objects.requireNonNull(assetId, "assetId must not be null");
        Objects.requireNonNull(grossAmountEur, "grossAmountEur must not be null");
        fundType = FundType.orNone(fundType);
    }

    /**
     * Derives the exemption from the fund type; the exemption amount is quantized to cents.
     */
    public static VorabpauschaleItem of(UUID assetId, int taxYear, FundType fundType, BigDecimal grossAmountEur,
                                        NumericContext numeric) {
        FundType type = FundType.orNone(fundType);
        BigDecimal rate = type.getExemptionRate();
        BigDecimal exemption = numeric.quantizeAmount(numeric.multiply(grossAmountEur.abs(), rate));
        BigDecimal net = grossAmountEur.signum() >= 0
                ? grossAmountEur.subtract(exemption)
                : grossAmountEur.add(exemption);
        return new VorabpauschaleItem(assetId, taxYear, type, grossAmountEur, rate, exemption, net);
    }
}
