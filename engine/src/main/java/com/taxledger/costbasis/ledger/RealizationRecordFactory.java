package com.taxledger.costbasis.ledger;

import com.taxledger.common.NumericContext;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FundType;
import com.taxledger.domain.RealizationType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.TaxReportingCategory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Builds realized-gain/loss records for one asset, applying the category rules, the §23 holding period and the
 * fund Teilfreistellung.
 */
public class RealizationRecordFactory {

    private final UUID assetId;
    private final AssetCategory category;
    private final FundType fundType;
    private final NumericContext numeric;

    public RealizationRecordFactory(UUID assetId, AssetCategory category, FundType fundType, NumericContext numeric) {
        this.assetId = assetId;
        this.category = category;
        this.fundType = category == AssetCategory.INVESTMENT_FUND ? FundType.orNone(fundType) : null;
        this.numeric = numeric;
    }

    /**
     * @param writerSide true when the slice closes a short position; a non-negative result on a short option
     *                   is Stillhalter (premium writer) income
     */
    public RealizedGainLoss create(UUID originatingEventId, LocalDate acquisitionDate, LocalDate realizationDate,
                                   RealizationType realizationType, BigDecimal quantity,
                                   BigDecimal unitCostBasisEur, BigDecimal unitRealizationValueEur,
                                   BigDecimal totalCostBasisEur, BigDecimal totalRealizationValueEur,
                                   boolean writerSide) {
        BigDecimal gross = numeric.subtract(totalRealizationValueEur, totalCostBasisEur);
        Integer holdingDays = TaxCategoryRules.holdingPeriodDays(acquisitionDate, realizationDate);
        TaxReportingCategory taxCategory = TaxCategoryRules.categoryFor(category, fundType, gross, holdingDays);
        boolean stillhalter = writerSide && category == AssetCategory.OPTION && gross.signum() >= 0;
        boolean section23Taxable = category != AssetCategory.PRIVATE_SALE_ASSET
                || TaxCategoryRules.isWithinSpeculationPeriod(holdingDays);

        RealizedGainLoss.RealizedGainLossBuilder builder = RealizedGainLoss.builder()
                .originatingEventId(originatingEventId)
                .assetId(assetId)
                .assetCategory(category)
                .acquisitionDate(acquisitionDate)
                .realizationDate(realizationDate)
                .realizationType(realizationType)
                .quantityRealized(quantity)
                .unitCostBasisEur(perUnit(unitCostBasisEur))
                .unitRealizationValueEur(perUnit(unitRealizationValueEur))
                .totalCostBasisEur(totalCostBasisEur)
                .totalRealizationValueEur(totalRealizationValueEur)
                .grossGainLossEur(gross)
                .holdingPeriodDays(holdingDays)
                .taxReportingCategory(taxCategory)
                .stillhalterIncome(stillhalter)
                .taxableUnderSection23(section23Taxable);

        if (fundType != null) {
            BigDecimal rate = fundType.getExemptionRate();
            BigDecimal exemption = numeric.quantizeAmount(numeric.multiply(gross.abs(), rate));
            BigDecimal net = gross.signum() >= 0 ? numeric.subtract(gross, exemption) : numeric.add(gross, exemption);
            builder.fundType(fundType)
                    .exemptionRate(rate)
                    .exemptionAmountEur(exemption)
                    .netGainLossEur(net);
        }
        return builder.build();
    }

    private BigDecimal perUnit(BigDecimal value) {
        return value == null ? null : numeric.quantizePerUnit(value);
    }
}
