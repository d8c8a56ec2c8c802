package com.taxledger.report;

import com.taxledger.costbasis.engine.CalculationResult;
import com.taxledger.costbasis.offsetting.LossOffsettingResult;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Everything a report renderer needs for one tax year (records, processed events, EOY mismatches, form lines).
 */
@Getter
@RequiredArgsConstructor
public class TaxYearReport {

    private final CalculationResult calculation;
    private final LossOffsettingResult offsetting;

    public int getTaxYear() {
        return calculation.getTaxYear().year();
    }

    public boolean isReconciled() {
        return calculation.getEoyMismatchCount() == 0;
    }
}
