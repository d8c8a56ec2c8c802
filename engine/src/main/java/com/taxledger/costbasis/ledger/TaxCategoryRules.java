package com.taxledger.costbasis.ledger;

import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FundType;
import com.taxledger.domain.RealizationType;
import com.taxledger.domain.TaxReportingCategory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Maps a realized slice to its realization type and reporting category by asset category.
 */
public final class TaxCategoryRules {

    /** §23 EStG speculation period: disposals within this many days of acquisition are taxable. */
    public static final int SECTION_23_HOLDING_DAYS = 365;

    private TaxCategoryRules() {
    }

    public static RealizationType closingType(AssetCategory category, boolean shortSide) {
        if (category == AssetCategory.OPTION) {
            return shortSide ? RealizationType.OPTION_TRADE_CLOSE_SHORT : RealizationType.OPTION_TRADE_CLOSE_LONG;
        }
        return shortSide ? RealizationType.SHORT_POSITION_COVER : RealizationType.LONG_POSITION_SALE;
    }

    /** Days between acquisition and realization; null when the realization date precedes the acquisition. */
    public static Integer holdingPeriodDays(LocalDate acquisitionDate, LocalDate realizationDate) {
        if (acquisitionDate == null || realizationDate == null || realizationDate.isBefore(acquisitionDate)) {
            return null;
        }
        return (int) ChronoUnit.DAYS.between(acquisitionDate, realizationDate);
    }

    public static boolean isWithinSpeculationPeriod(Integer holdingPeriodDays) {
        return holdingPeriodDays != null && holdingPeriodDays <= SECTION_23_HOLDING_DAYS;
    }

    /**
     * Reporting category for a realized gross result. Returns null for categories that are not reported
     * (cash balances, unknown instruments).
     */
    public static TaxReportingCategory categoryFor(AssetCategory category, FundType fundType,
                                                   BigDecimal grossGainLoss, Integer holdingPeriodDays) {
        boolean gain = grossGainLoss.signum() >= 0;
        return switch (category) {
            case STOCK -> gain ? TaxReportingCategory.ANLAGE_KAP_AKTIEN_GEWINN : TaxReportingCategory.ANLAGE_KAP_AKTIEN_VERLUST;
            case BOND -> gain ? TaxReportingCategory.ANLAGE_KAP_SONSTIGE_KAPITALERTRAEGE : TaxReportingCategory.ANLAGE_KAP_SONSTIGE_VERLUSTE;
            case OPTION, CFD -> gain ? TaxReportingCategory.ANLAGE_KAP_TERMIN_GEWINN : TaxReportingCategory.ANLAGE_KAP_TERMIN_VERLUST;
            case INVESTMENT_FUND -> FundType.orNone(fundType).getSaleGainCategory();
            case PRIVATE_SALE_ASSET -> {
                if (!isWithinSpeculationPeriod(holdingPeriodDays)) {
                    yield TaxReportingCategory.SECTION_23_ESTG_EXEMPT_HOLDING_PERIOD_MET;
                }
                yield gain ? TaxReportingCategory.SECTION_23_ESTG_TAXABLE_GAIN : TaxReportingCategory.SECTION_23_ESTG_TAXABLE_LOSS;
            }
            case CASH_BALANCE, UNKNOWN -> null;
        };
    }
}
