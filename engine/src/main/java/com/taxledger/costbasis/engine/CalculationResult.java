package com.taxledger.costbasis.engine;

import com.taxledger.common.TaxYear;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.VorabpauschaleItem;
import com.taxledger.domain.event.FinancialEvent;
import lombok.Getter;

import java.util.List;

/**
 * Output of one engine run. Never persisted; the report layer reads it as is.
 */
@Getter
public class CalculationResult {

    private final TaxYear taxYear;
    private final List<RealizedGainLoss> realizedGainLosses;
    private final List<VorabpauschaleItem> vorabpauschaleItems;
    /** Current-year events in processing order, with option premium adjustments applied to linked stock trades. */
    private final List<FinancialEvent> processedEvents;
    private final List<CapitalRepaymentExcess> capitalRepaymentExcesses;
    private final List<EoyMismatch> eoyMismatches;
    private final int droppedFutureEvents;

    public CalculationResult(TaxYear taxYear,
                             List<RealizedGainLoss> realizedGainLosses,
                             List<VorabpauschaleItem> vorabpauschaleItems,
                             List<FinancialEvent> processedEvents,
                             List<CapitalRepaymentExcess> capitalRepaymentExcesses,
                             List<EoyMismatch> eoyMismatches,
                             int droppedFutureEvents) {
        this.taxYear = taxYear;
        this.realizedGainLosses = List.copyOf(realizedGainLosses);
        this.vorabpauschaleItems = List.copyOf(vorabpauschaleItems);
        this.processedEvents = List.copyOf(processedEvents);
        this.capitalRepaymentExcesses = List.copyOf(capitalRepaymentExcesses);
        this.eoyMismatches = List.copyOf(eoyMismatches);
        this.droppedFutureEvents = droppedFutureEvents;
    }

    public int getEoyMismatchCount() {
        return eoyMismatches.size();
    }
}
