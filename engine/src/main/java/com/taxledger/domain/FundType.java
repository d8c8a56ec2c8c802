package com.taxledger.domain;

import java.math.BigDecimal;

/**
 * Investment fund subtype (InvStG) with its Teilfreistellung rate and KAP-INV reporting categories.
 */
public enum FundType {
    AKTIENFONDS("0.30",
            TaxReportingCategory.KAP_INV_AKTIENFONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_AKTIENFONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_AKTIENFONDS_VORABPAUSCHALE_BRUTTO),
    MISCHFONDS("0.15",
            TaxReportingCategory.KAP_INV_MISCHFONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_MISCHFONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_MISCHFONDS_VORABPAUSCHALE_BRUTTO),
    IMMOBILIENFONDS("0.60",
            TaxReportingCategory.KAP_INV_IMMOBILIENFONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_IMMOBILIENFONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_IMMOBILIENFONDS_VORABPAUSCHALE_BRUTTO),
    AUSLANDS_IMMOBILIENFONDS("0.80",
            TaxReportingCategory.KAP_INV_AUSLANDS_IMMOBILIENFONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_AUSLANDS_IMMOBILIENFONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_AUSLANDS_IMMOBILIENFONDS_VORABPAUSCHALE_BRUTTO),
    SONSTIGE_FONDS("0",
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_VORABPAUSCHALE_BRUTTO),
    /** Fund without a known subtype; treated like SONSTIGE_FONDS for reporting. */
    NONE("0",
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_GEWINN_GROSS,
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_AUSSCHUETTUNG_GROSS,
            TaxReportingCategory.KAP_INV_SONSTIGE_FONDS_VORABPAUSCHALE_BRUTTO);

    private final BigDecimal exemptionRate;
    private final TaxReportingCategory saleGainCategory;
    private final TaxReportingCategory distributionCategory;
    private final TaxReportingCategory vorabpauschaleCategory;

    FundType(String exemptionRate, TaxReportingCategory saleGainCategory, TaxReportingCategory distributionCategory,
             TaxReportingCategory vorabpauschaleCategory) {
        this.exemptionRate = new BigDecimal(exemptionRate);
        this.saleGainCategory = saleGainCategory;
        this.distributionCategory = distributionCategory;
        this.vorabpauschaleCategory = vorabpauschaleCategory;
    }

    public BigDecimal getExemptionRate() {
        return exemptionRate;
    }

    public TaxReportingCategory getSaleGainCategory() {
        return saleGainCategory;
    }

    public TaxReportingCategory getDistributionCategory() {
        return distributionCategory;
    }

    public TaxReportingCategory getVorabpauschaleCategory() {
        return vorabpauschaleCategory;
    }

    /** Null-safe lookup: an unclassified fund gets NONE. */
    public static FundType orNone(FundType fundType) {
        return fundType != null ? fundType : NONE;
    }
}
