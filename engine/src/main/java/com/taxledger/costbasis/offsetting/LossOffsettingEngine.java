package com.taxledger.costbasis.offsetting;

import com.taxledger.asset.AssetLookup;
import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.FundType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.TaxReportingCategory;
import com.taxledger.domain.VorabpauschaleItem;
import com.taxledger.domain.event.FinancialEvent;
import com.taxledger.costbasis.engine.CalculationResult;
import com.taxledger.costbasis.engine.CapitalRepaymentExcess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates realized results and current-year income into Anlage KAP, KAP-INV and SO figures.
 * <p>
 * Gains and losses are summed separately per pot. Zeile 19 nets stock, derivative-gain and other-income pots but
 * leaves derivative losses out; those only reduce the conceptual derivative net, which is floored at the configured
 * cap when capping is enabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LossOffsettingEngine {

    private final NumericContext numeric;
    private final OffsettingPolicy policy;

    public LossOffsettingResult aggregate(CalculationResult calculation, AssetLookup assets) {
        return aggregate(calculation.getRealizedGainLosses(), calculation.getProcessedEvents(),
                calculation.getVorabpauschaleItems(), calculation.getCapitalRepaymentExcesses(), assets);
    }

    public LossOffsettingResult aggregate(List<RealizedGainLoss> records,
                                          List<? extends FinancialEvent> events,
                                          List<VorabpauschaleItem> vorabpauschaleItems,
                                          List<CapitalRepaymentExcess> capitalRepaymentExcesses,
                                          AssetLookup assets) {
        Pots pots = new Pots();
        Map<TaxReportingCategory, BigDecimal> kapInv = new EnumMap<>(TaxReportingCategory.class);

        for (RealizedGainLoss record : records) {
            addRealized(pots, kapInv, record);
        }
        for (FinancialEvent event : events) {
            Optional<Asset> asset = assets.findAsset(event.assetId());
            if (asset.isEmpty()) {
                log.warn("Event {} references unknown asset {}; left out of income aggregation", event.eventId(), event.assetId());
                continue;
            }
            addIncome(pots, kapInv, event, asset.get());
        }
        for (VorabpauschaleItem item : vorabpauschaleItems) {
            BigDecimal net = item.netAmountEur() != null ? item.netAmountEur() : BigDecimal.ZERO;
            pots.fundIncomeNet = numeric.add(pots.fundIncomeNet, net);
            if (item.grossAmountEur().signum() != 0) {
                kapInv.merge(item.fundType().getVorabpauschaleCategory(), item.grossAmountEur(), numeric::add);
            }
        }
        for (CapitalRepaymentExcess excess : capitalRepaymentExcesses) {
            pots.otherIncome = numeric.add(pots.otherIncome, excess.amountEur());
        }

        return build(pots, kapInv);
    }

    private void addRealized(Pots pots, Map<TaxReportingCategory, BigDecimal> kapInv, RealizedGainLoss record) {
        BigDecimal gross = record.grossGainLossEur();
        switch (record.assetCategory()) {
            case STOCK -> {
                if (gross.signum() > 0) {
                    pots.stockGains = numeric.add(pots.stockGains, gross);
                } else {
                    pots.stockLosses = numeric.add(pots.stockLosses, gross.abs());
                }
            }
            case OPTION, CFD -> {
                if (gross.signum() > 0) {
                    pots.derivativeGains = numeric.add(pots.derivativeGains, gross);
                } else {
                    pots.derivativeLosses = numeric.add(pots.derivativeLosses, gross.abs());
                }
            }
            case BOND -> {
                if (gross.signum() > 0) {
                    pots.otherIncome = numeric.add(pots.otherIncome, gross);
                } else {
                    pots.otherLosses = numeric.add(pots.otherLosses, gross.abs());
                }
            }
            case INVESTMENT_FUND -> {
                pots.fundIncomeNet = numeric.add(pots.fundIncomeNet, record.netGainLossEur());
                TaxReportingCategory category = record.taxReportingCategory() != null
                        ? record.taxReportingCategory()
                        : FundType.orNone(record.fundType()).getSaleGainCategory();
                kapInv.merge(category, gross, numeric::add);
            }
            case PRIVATE_SALE_ASSET -> {
                if (record.taxableUnderSection23()) {
                    pots.section23Net = numeric.add(pots.section23Net, gross);
                }
            }
            default -> log.warn("Realized record of event {} has category {}; not aggregated",
                    record.originatingEventId(), record.assetCategory());
        }
    }

    private void addIncome(Pots pots, Map<TaxReportingCategory, BigDecimal> kapInv, FinancialEvent event, Asset asset) {
        BigDecimal gross = event.grossAmountEur() != null ? event.grossAmountEur() : BigDecimal.ZERO;
        FinancialEventType type = event.type();
        switch (type) {
            case DIVIDEND_CASH, CORP_STOCK_DIVIDEND -> {
                if (asset.category() == AssetCategory.STOCK && gross.signum() > 0) {
                    pots.otherIncome = numeric.add(pots.otherIncome, gross);
                }
            }
            case INTEREST_RECEIVED -> {
                if (gross.signum() > 0) {
                    pots.otherIncome = numeric.add(pots.otherIncome, gross);
                }
            }
            case INTEREST_PAID_STUECKZINSEN -> pots.otherLosses = numeric.add(pots.otherLosses, gross.abs());
            case DISTRIBUTION_FUND -> {
                if (asset.category() != AssetCategory.INVESTMENT_FUND) {
                    log.error("Fund distribution {} on non-fund asset {}; left out of fund income", event.eventId(), asset.displayName());
                    return;
                }
                FundType fundType = FundType.orNone(asset.fundType());
                BigDecimal exemption = gross.signum() > 0 ? numeric.multiply(gross, fundType.getExemptionRate()) : BigDecimal.ZERO;
                BigDecimal net = numeric.quantizeAmount(numeric.subtract(gross, exemption));
                pots.fundIncomeNet = numeric.add(pots.fundIncomeNet, net);
                if (event.grossAmountEur() != null) {
                    kapInv.merge(fundType.getDistributionCategory(), gross, numeric::add);
                }
            }
            case WITHHOLDING_TAX -> pots.foreignTaxPaid = numeric.add(pots.foreignTaxPaid, gross.abs());
            default -> log.debug("Event {} ({}) carries no income for aggregation", event.eventId(), type);
        }
    }

    private LossOffsettingResult build(Pots pots, Map<TaxReportingCategory, BigDecimal> kapInv) {
        Map<TaxReportingCategory, BigDecimal> lines = new EnumMap<>(TaxReportingCategory.class);
        lines.put(TaxReportingCategory.ANLAGE_KAP_AKTIEN_GEWINN, numeric.quantizeAmount(pots.stockGains));
        lines.put(TaxReportingCategory.ANLAGE_KAP_AKTIEN_VERLUST, numeric.quantizeAmount(pots.stockLosses));
        lines.put(TaxReportingCategory.ANLAGE_KAP_TERMIN_GEWINN, numeric.quantizeAmount(pots.derivativeGains));
        lines.put(TaxReportingCategory.ANLAGE_KAP_TERMIN_VERLUST, numeric.quantizeAmount(pots.derivativeLosses));
        lines.put(TaxReportingCategory.ANLAGE_KAP_SONSTIGE_KAPITALERTRAEGE, numeric.quantizeAmount(pots.otherIncome));
        lines.put(TaxReportingCategory.ANLAGE_KAP_SONSTIGE_VERLUSTE, numeric.quantizeAmount(pots.otherLosses));
        lines.put(TaxReportingCategory.ANLAGE_KAP_FOREIGN_TAX_PAID, numeric.quantizeAmount(pots.foreignTaxPaid));

        BigDecimal zeile19 = numeric.add(pots.stockGains, pots.derivativeGains);
        zeile19 = numeric.add(zeile19, pots.otherIncome);
        zeile19 = numeric.subtract(zeile19, pots.stockLosses);
        zeile19 = numeric.subtract(zeile19, pots.otherLosses);
        lines.put(TaxReportingCategory.ANLAGE_KAP_AUSLAENDISCHE_KAPITALERTRAEGE_GESAMT, numeric.quantizeAmount(zeile19));
        lines.put(TaxReportingCategory.ANLAGE_SO_Z54_NET_GV, numeric.quantizeAmount(pots.section23Net));
        kapInv.forEach((category, value) -> lines.put(category, numeric.quantizeAmount(value)));

        BigDecimal derivativesNet = numeric.subtract(pots.derivativeGains, pots.derivativeLosses);
        BigDecimal derivativesCapped = derivativesNet;
        if (policy.capDerivativeLosses() && derivativesNet.signum() < 0) {
            derivativesCapped = derivativesNet.max(policy.derivativeLossCap());
            if (derivativesCapped.compareTo(derivativesNet) != 0) {
                log.info("Derivative net {} capped at {}", derivativesNet, policy.derivativeLossCap());
            }
        }

        LossOffsettingResult result = LossOffsettingResult.builder()
                .formLineValues(lines)
                .conceptualNetStocks(numeric.quantizeAmount(numeric.subtract(pots.stockGains, pots.stockLosses)))
                .conceptualNetDerivativesUncapped(numeric.quantizeAmount(derivativesNet))
                .conceptualNetDerivativesCapped(numeric.quantizeAmount(derivativesCapped))
                .conceptualNetOtherIncome(numeric.quantizeAmount(numeric.subtract(pots.otherIncome, pots.otherLosses)))
                .conceptualFundIncomeNetTaxable(numeric.quantizeAmount(pots.fundIncomeNet))
                .conceptualNetSection23(numeric.quantizeAmount(pots.section23Net))
                .build();
        log.info("Loss offsetting: Zeile 19 {}, derivatives net {} (capped {}), fund income {}, §23 {}",
                lines.get(TaxReportingCategory.ANLAGE_KAP_AUSLAENDISCHE_KAPITALERTRAEGE_GESAMT),
                result.getConceptualNetDerivativesUncapped(), result.getConceptualNetDerivativesCapped(),
                result.getConceptualFundIncomeNetTaxable(), result.getConceptualNetSection23());
        return result;
    }

    private static final class Pots {
        private BigDecimal stockGains = BigDecimal.ZERO;
        private BigDecimal stockLosses = BigDecimal.ZERO;
        private BigDecimal derivativeGains = BigDecimal.ZERO;
        private BigDecimal derivativeLosses = BigDecimal.ZERO;
        private BigDecimal otherIncome = BigDecimal.ZERO;
        private BigDecimal otherLosses = BigDecimal.ZERO;
        private BigDecimal fundIncomeNet = BigDecimal.ZERO;
        private BigDecimal section23Net = BigDecimal.ZERO;
        private BigDecimal foreignTaxPaid = BigDecimal.ZERO;
    }
}
