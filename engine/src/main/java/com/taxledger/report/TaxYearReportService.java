package com.taxledger.report;

import com.taxledger.asset.AssetLookup;
import com.taxledger.costbasis.engine.CalculationEngine;
import com.taxledger.costbasis.engine.CalculationResult;
import com.taxledger.costbasis.offsetting.LossOffsettingEngine;
import com.taxledger.costbasis.offsetting.LossOffsettingResult;
import com.taxledger.domain.VorabpauschaleItem;
import com.taxledger.domain.event.FinancialEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the FIFO engine and loss offsetting for one tax year.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxYearReportService {

    private final CalculationEngine calculationEngine;
    private final LossOffsettingEngine lossOffsettingEngine;

    public TaxYearReport generate(int taxYear, AssetLookup assets, List<? extends FinancialEvent> events) {
        return generate(taxYear, assets, events, List.of());
    }

    public TaxYearReport generate(int taxYear, AssetLookup assets, List<? extends FinancialEvent> events,
                                  List<VorabpauschaleItem> vorabpauschaleItems) {
        CalculationResult calculation = calculationEngine.run(taxYear, assets, events, vorabpauschaleItems);
        LossOffsettingResult offsetting = lossOffsettingEngine.aggregate(calculation, assets);
        if (calculation.getEoyMismatchCount() > 0) {
            log.warn("Report for {} built with {} EOY mismatches; figures need manual review",
                    taxYear, calculation.getEoyMismatchCount());
        }
        return new TaxYearReport(calculation, offsetting);
    }
}
