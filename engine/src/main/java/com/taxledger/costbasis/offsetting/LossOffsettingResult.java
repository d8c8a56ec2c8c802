package com.taxledger.costbasis.offsetting;

import com.taxledger.domain.TaxReportingCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Form line totals (gross, uncapped, quantized to cents) plus conceptual per-pot net balances.
 */
@Getter
@Builder
public class LossOffsettingResult {

    @Singular
    private final Map<TaxReportingCategory, BigDecimal> formLineValues;

    private final BigDecimal conceptualNetStocks;
    private final BigDecimal conceptualNetDerivativesUncapped;
    private final BigDecimal conceptualNetDerivativesCapped;
    private final BigDecimal conceptualNetOtherIncome;
    /** Funds: sale results, distributions and Vorabpauschale, each net of Teilfreistellung. Not part of Zeile 19. */
    private final BigDecimal conceptualFundIncomeNetTaxable;
    private final BigDecimal conceptualNetSection23;

    /** Zero when the line was not produced. */
    public BigDecimal formLineOrZero(TaxReportingCategory category) {
        return formLineValues.getOrDefault(category, BigDecimal.ZERO);
    }
}
