package com.taxledger.costbasis.engine;

import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.event.CashMergerEvent;
import com.taxledger.domain.event.CorporateActionEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.costbasis.ledger.FifoLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies corporate actions to a ledger. Stock mergers and other actions without a lot rule are reported and left
 * for manual review.
 */
@Component
@Slf4j
public class CorporateActionProcessor {

    public void split(SplitEvent split, FifoLedger ledger) {
        ledger.adjustLotsForSplit(split);
    }

    public List<RealizedGainLoss> cashMerger(CashMergerEvent merger, FifoLedger ledger) {
        return ledger.consumeAllLotsForCashMerger(merger);
    }

    public void stockDividend(StockDividendEvent dividend, FifoLedger ledger) {
        ledger.addLotForStockDividend(dividend);
    }

    public void unsupported(CorporateActionEvent action) {
        log.warn("Corporate action {} ({}, id {}) on asset {} dated {} has no lot rule; no records created, review manually",
                action.type(), action.eventId(), action.corporateActionId(), action.assetId(), action.eventDate());
    }
}
