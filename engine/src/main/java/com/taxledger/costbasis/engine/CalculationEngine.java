package com.taxledger.costbasis.engine;

import com.taxledger.asset.AssetLookup;
import com.taxledger.common.NumericContext;
import com.taxledger.common.TaxYear;
import com.taxledger.domain.Asset;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.VorabpauschaleItem;
import com.taxledger.domain.event.CashFlowEvent;
import com.taxledger.domain.event.CashMergerEvent;
import com.taxledger.domain.event.CurrencyConversionEvent;
import com.taxledger.domain.event.ExpireDividendRightsEvent;
import com.taxledger.domain.event.FeeEvent;
import com.taxledger.domain.event.FinancialEvent;
import com.taxledger.domain.event.FinancialEventVisitor;
import com.taxledger.domain.event.OptionAssignmentEvent;
import com.taxledger.domain.event.OptionExerciseEvent;
import com.taxledger.domain.event.OptionExpirationEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.domain.event.StockMergerEvent;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.domain.event.WithholdingTaxEvent;
import com.taxledger.costbasis.ledger.FifoLedger;
import com.taxledger.costbasis.ledger.SoyReconstructor;
import com.taxledger.costbasis.ordering.EventOrdering;
import com.taxledger.pricing.CurrencyConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one tax year: partition events around the year boundaries, seed one FIFO ledger per non-cash asset from its
 * start-of-year position, dispatch the year's events in canonical order and reconcile the end-of-year positions.
 * Single-threaded; all mutable state lives in a per-run {@link Run}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalculationEngine {

    private final NumericContext numeric;
    private final CurrencyConverter currencyConverter;
    private final TradeProcessor tradeProcessor;
    private final CorporateActionProcessor corporateActionProcessor;
    private final OptionLifecycleProcessor optionLifecycleProcessor;

    public CalculationResult run(int taxYear, AssetLookup assets, List<? extends FinancialEvent> events) {
        return run(taxYear, assets, events, List.of());
    }

    /**
     * @param vorabpauschaleItems fund Vorabpauschale figures for the year; items for other years are ignored
     * @throws CalculationException on any fatal condition (bad tax year, unknown asset, seeding failure,
     *                              insufficient lots, broken option link, malformed event)
     * @throws com.taxledger.costbasis.ordering.EventOrderingException when an event has no date
     */
    public CalculationResult run(int taxYear, AssetLookup assets, List<? extends FinancialEvent> events,
                                 List<VorabpauschaleItem> vorabpauschaleItems) {
        TaxYear year;
        try {
            year = TaxYear.of(taxYear);
        } catch (IllegalArgumentException e) {
            log.error("Cannot form tax year boundaries for {}", taxYear);
            throw new CalculationException(CalculationException.INVALID_TAX_YEAR, e.getMessage(), e);
        }
        log.info("Starting calculation for tax year {} with {} events and {} assets", taxYear, events.size(), assets.allAssets().size());

        Run run = new Run(year, assets);
        run.partition(events);
        run.seed();
        run.dispatch();
        List<EoyMismatch> mismatches = new EoyReconciler(numeric).reconcile(run.ledgers, assets);

        List<VorabpauschaleItem> yearItems = new ArrayList<>();
        for (VorabpauschaleItem item : vorabpauschaleItems) {
            if (item.taxYear() == taxYear) {
                yearItems.add(item);
            } else {
                log.warn("Vorabpauschale item for asset {} belongs to {} not {}; ignored", item.assetId(), item.taxYear(), taxYear);
            }
        }

        log.info("Calculation for {} finished: {} realized records, {} Vorabpauschale items, {} EOY mismatches, {} pending option adjustments",
                taxYear, run.records.size(), yearItems.size(), mismatches.size(), run.pending.size());
        return new CalculationResult(year, run.records, yearItems, run.processed, run.excesses, mismatches, run.droppedFutureEvents);
    }

    private final class Run implements FinancialEventVisitor<Void> {

        private final TaxYear year;
        private final AssetLookup assets;
        private final Map<UUID, List<FinancialEvent>> historyByAsset = new LinkedHashMap<>();
        private final List<FinancialEvent> current = new ArrayList<>();
        private final Map<UUID, FifoLedger> ledgers = new LinkedHashMap<>();
        private final PendingOptionAdjustments pending = new PendingOptionAdjustments();
        private final List<RealizedGainLoss> records = new ArrayList<>();
        private final List<FinancialEvent> processed = new ArrayList<>();
        private final List<CapitalRepaymentExcess> excesses = new ArrayList<>();
        private int droppedFutureEvents;

        private Run(TaxYear year, AssetLookup assets) {
            this.year = year;
            this.assets = assets;
        }

        private void partition(List<? extends FinancialEvent> events) {
            for (FinancialEvent event : events) {
                asset(event);
            }
            int historical = 0;
            for (FinancialEvent event : EventOrdering.sort(events, assets)) {
                if (year.isBeforeStart(event.eventDate())) {
                    if (isReplayable(event.type())) {
                        historyByAsset.computeIfAbsent(event.assetId(), id -> new ArrayList<>()).add(event);
                        historical++;
                    }
                } else if (year.isAfterEnd(event.eventDate())) {
                    droppedFutureEvents++;
                    log.debug("Dropped event {} dated {} after tax year {}", event.eventId(), event.eventDate(), year.year());
                } else {
                    current.add(event);
                }
            }
            if (droppedFutureEvents > 0) {
                log.info("Dropped {} events after tax year {}", droppedFutureEvents, year.year());
            }
            log.info("Partitioned events: {} historical for SOY replay, {} in tax year {}", historical, current.size(), year.year());
        }

        private void seed() {
            Map<SoyReconstructor.SoySeed, Integer> outcomes = new EnumMap<>(SoyReconstructor.SoySeed.class);
            SoyReconstructor reconstructor = new SoyReconstructor(numeric, currencyConverter);
            for (Asset asset : assets.allAssets()) {
                if (!asset.category().isLedgerBearing()) {
                    continue;
                }
                FifoLedger ledger = new FifoLedger(asset, numeric);
                try {
                    SoyReconstructor.SoySeed outcome = reconstructor.seed(ledger, asset,
                            historyByAsset.getOrDefault(asset.id(), List.of()), year);
                    outcomes.merge(outcome, 1, Integer::sum);
                } catch (RuntimeException e) {
                    log.error("Seeding ledger for {} failed: {}", asset.displayName(), e.getMessage(), e);
                    throw new CalculationException(CalculationException.SEED_FAILED,
                            "Seeding ledger for " + asset.displayName() + " failed: " + e.getMessage(), e);
                }
                ledgers.put(asset.id(), ledger);
            }
            log.info("Initialized {} FIFO ledgers; SOY outcomes {}", ledgers.size(), outcomes);
        }

        private void dispatch() {
            for (FinancialEvent event : current) {
                log.debug("Dispatching {} {} on {}", event.type(), event.eventId(), event.eventDate());
                try {
                    event.accept(this);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    log.error("Event {} ({}) on {} cannot be processed: {}", event.eventId(), event.type(), event.eventDate(), e.getMessage());
                    throw new CalculationException(CalculationException.INVALID_EVENT,
                            "Event " + event.eventId() + " (" + event.type() + ") cannot be processed: " + e.getMessage(), e);
                }
            }
            log.info("Processed {} events of tax year {}", processed.size(), year.year());
        }

        private Asset asset(FinancialEvent event) {
            return assets.findAsset(event.assetId()).orElseThrow(() -> {
                String message = "Event " + event.eventId() + " (" + event.type() + ") references unknown asset " + event.assetId();
                log.error(message);
                return new CalculationException(CalculationException.UNKNOWN_ASSET, message);
            });
        }

        /** Null when the asset carries no ledger; callers log and skip. */
        private FifoLedger ledgerFor(FinancialEvent event) {
            FifoLedger ledger = ledgers.get(event.assetId());
            if (ledger == null) {
                log.warn("Event {} ({}) needs a FIFO ledger but asset {} has none; skipped",
                        event.eventId(), event.type(), asset(event).displayName());
            }
            return ledger;
        }

        @Override
        public Void visitTrade(TradeEvent trade) {
            TradeEvent effective = tradeProcessor.applyOptionPremium(trade, asset(trade), assets, pending);
            processed.add(effective);
            FifoLedger ledger = ledgerFor(effective);
            if (ledger != null) {
                records.addAll(tradeProcessor.process(effective, ledger));
            }
            return null;
        }

        @Override
        public Void visitCashFlow(CashFlowEvent cashFlow) {
            processed.add(cashFlow);
            if (cashFlow.type() != FinancialEventType.CAPITAL_REPAYMENT) {
                log.debug("{} {} needs no ledger", cashFlow.type(), cashFlow.eventId());
                return null;
            }
            FifoLedger ledger = ledgers.get(cashFlow.assetId());
            BigDecimal amount = cashFlow.grossAmountEur() != null ? cashFlow.grossAmountEur() : BigDecimal.ZERO;
            BigDecimal excess = ledger != null ? ledger.reduceCostBasisForCapitalRepayment(amount) : amount;
            log.info("Capital repayment {} of {} EUR on asset {}; excess {}", cashFlow.eventId(), amount, cashFlow.assetId(), excess);
            if (excess.signum() > 0) {
                excesses.add(new CapitalRepaymentExcess(cashFlow.eventId(), cashFlow.assetId(), cashFlow.eventDate(), excess));
            }
            return null;
        }

        @Override
        public Void visitWithholdingTax(WithholdingTaxEvent tax) {
            processed.add(tax);
            return null;
        }

        @Override
        public Void visitFee(FeeEvent fee) {
            processed.add(fee);
            return null;
        }

        @Override
        public Void visitCurrencyConversion(CurrencyConversionEvent conversion) {
            processed.add(conversion);
            return null;
        }

        @Override
        public Void visitSplit(SplitEvent split) {
            processed.add(split);
            FifoLedger ledger = ledgerFor(split);
            if (ledger != null) {
                corporateActionProcessor.split(split, ledger);
            }
            return null;
        }

        @Override
        public Void visitCashMerger(CashMergerEvent merger) {
            processed.add(merger);
            FifoLedger ledger = ledgerFor(merger);
            if (ledger != null) {
                records.addAll(corporateActionProcessor.cashMerger(merger, ledger));
            }
            return null;
        }

        @Override
        public Void visitStockMerger(StockMergerEvent merger) {
            processed.add(merger);
            corporateActionProcessor.unsupported(merger);
            return null;
        }

        @Override
        public Void visitStockDividend(StockDividendEvent dividend) {
            processed.add(dividend);
            FifoLedger ledger = ledgerFor(dividend);
            if (ledger != null) {
                corporateActionProcessor.stockDividend(dividend, ledger);
            }
            return null;
        }

        @Override
        public Void visitExpireDividendRights(ExpireDividendRightsEvent expiry) {
            processed.add(expiry);
            corporateActionProcessor.unsupported(expiry);
            return null;
        }

        @Override
        public Void visitOptionExercise(OptionExerciseEvent exercise) {
            processed.add(exercise);
            FifoLedger ledger = ledgerFor(exercise);
            if (ledger != null) {
                optionLifecycleProcessor.exercise(exercise, ledger, asset(exercise), pending);
            }
            return null;
        }

        @Override
        public Void visitOptionAssignment(OptionAssignmentEvent assignment) {
            processed.add(assignment);
            FifoLedger ledger = ledgerFor(assignment);
            if (ledger != null) {
                optionLifecycleProcessor.assign(assignment, ledger, asset(assignment), pending);
            }
            return null;
        }

        @Override
        public Void visitOptionExpiration(OptionExpirationEvent expiration) {
            processed.add(expiration);
            FifoLedger ledger = ledgerFor(expiration);
            if (ledger != null) {
                records.addAll(optionLifecycleProcessor.expire(expiration, ledger));
            }
            return null;
        }
    }

    private static boolean isReplayable(FinancialEventType type) {
        return type.isTrade() || type == FinancialEventType.CORP_SPLIT_FORWARD || type == FinancialEventType.CORP_STOCK_DIVIDEND;
    }
}
