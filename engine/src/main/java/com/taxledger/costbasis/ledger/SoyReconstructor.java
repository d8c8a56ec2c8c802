package com.taxledger.costbasis.ledger;

import com.taxledger.common.NumericContext;
import com.taxledger.common.TaxYear;
import com.taxledger.domain.Asset;
import com.taxledger.domain.event.DefaultFinancialEventVisitor;
import com.taxledger.domain.event.FinancialEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.pricing.ConversionResult;
import com.taxledger.pricing.CurrencyConverter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds a ledger with its start-of-year lots. Replays pre-year history to rebuild true acquisition dates and costs;
 * when the replay is inconsistent or cannot explain the broker-reported SOY quantity, the whole reconstruction is
 * discarded in favour of one synthetic lot dated Dec 31 of the prior year, priced from the reported SOY cost basis.
 */
@Slf4j
public class SoyReconstructor {

    private static final BigDecimal ASSIGNMENT_TOLERANCE = new BigDecimal("1e-8");
    private static final String EUR = "EUR";

    private final NumericContext numeric;
    private final CurrencyConverter currencyConverter;

    public SoyReconstructor(NumericContext numeric, CurrencyConverter currencyConverter) {
        this.numeric = numeric;
        this.currencyConverter = currencyConverter;
    }

    /**
     * @param history events of this asset dated before the tax year, already in processing order
     * @throws IllegalArgumentException when a historical event is malformed (e.g. a trade without transaction id)
     */
    public SoySeed seed(FifoLedger ledger, Asset asset, List<FinancialEvent> history, TaxYear taxYear) {
        ledger.replaceLots(List.of(), List.of());
        ReplayVisitor replay = new ReplayVisitor(ledger);
        for (FinancialEvent event : history) {
            if (!taxYear.isBeforeStart(event.eventDate())) {
                log.warn("Historical event {} of asset {} dated {} is not before {}; skipped for SOY",
                        event.eventId(), asset.displayName(), event.eventDate(), taxYear.start());
                continue;
            }
            event.accept(replay);
        }

        List<FifoLot> reconstructedLong = new ArrayList<>(ledger.getLongLots());
        List<ShortFifoLot> reconstructedShort = new ArrayList<>(ledger.getShortLots());
        BigDecimal longQty = ledger.longQuantity();
        BigDecimal shortQty = ledger.shortQuantity();
        ledger.replaceLots(List.of(), List.of());

        BigDecimal reported = asset.soyQuantity();
        if (reported == null) {
            log.warn("Asset {}: no reported SOY quantity; assuming 0", asset.displayName());
            reported = BigDecimal.ZERO;
        }
        reported = numeric.quantizeQuantity(reported);
        log.info("Asset {}: reconstructed SOY long {} short {}, reported {}, replay consistent {}",
                asset.displayName(), longQty, shortQty, reported, replay.consistent);

        if (reported.signum() == 0) {
            return SoySeed.NO_POSITION;
        }
        if (replay.consistent) {
            if (reported.signum() > 0 && longQty.compareTo(reported) >= 0 && shortQty.signum() == 0) {
                List<FifoLot> assigned = takeLong(reconstructedLong, reported);
                if (assigned != null) {
                    ledger.replaceLots(assigned, List.of());
                    return SoySeed.RECONSTRUCTED;
                }
            } else if (reported.signum() < 0 && shortQty.compareTo(reported.abs()) >= 0 && longQty.signum() == 0) {
                List<ShortFifoLot> assigned = takeShort(reconstructedShort, reported.abs());
                if (assigned != null) {
                    ledger.replaceLots(List.of(), assigned);
                    return SoySeed.RECONSTRUCTED;
                }
            }
        }

        log.warn("Asset {}: history (long {}, short {}, consistent {}) does not explain reported SOY {}; using fallback lot",
                asset.displayName(), longQty, shortQty, replay.consistent, reported);
        if (reported.signum() > 0) {
            BigDecimal total = fallbackAmount(asset, taxYear, false);
            ledger.replaceLots(List.of(new FifoLot(taxYear.priorYearEnd(), reported, numeric.divide(total, reported), total,
                    "SOY_FALLBACK_" + asset.id())), List.of());
        } else {
            BigDecimal quantity = reported.abs();
            BigDecimal total = fallbackAmount(asset, taxYear, true);
            ledger.replaceLots(List.of(), List.of(new ShortFifoLot(taxYear.priorYearEnd(), quantity, numeric.divide(total, quantity), total,
                    "SOY_FALLBACK_SHORT_" + asset.id())));
        }
        return SoySeed.FALLBACK;
    }

    private List<FifoLot> takeLong(List<FifoLot> reconstructed, BigDecimal quantity) {
        List<FifoLot> assigned = new ArrayList<>();
        BigDecimal remaining = quantity;
        for (FifoLot lot : reconstructed) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal taken = lot.getQuantity().min(remaining);
            assigned.add(lot.copyWithQuantity(taken, numeric.mathContext()));
            remaining = remaining.subtract(taken);
        }
        if (remaining.abs().compareTo(ASSIGNMENT_TOLERANCE) > 0) {
            log.error("Reconstructed long lots left {} unassigned; falling back", remaining);
            return null;
        }
        return assigned;
    }

    private List<ShortFifoLot> takeShort(List<ShortFifoLot> reconstructed, BigDecimal quantity) {
        List<ShortFifoLot> assigned = new ArrayList<>();
        BigDecimal remaining = quantity;
        for (ShortFifoLot lot : reconstructed) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal taken = lot.getQuantityShorted().min(remaining);
            assigned.add(lot.copyWithQuantity(taken, numeric.mathContext()));
            remaining = remaining.subtract(taken);
        }
        if (remaining.abs().compareTo(ASSIGNMENT_TOLERANCE) > 0) {
            log.error("Reconstructed short lots left {} unassigned; falling back", remaining);
            return null;
        }
        return assigned;
    }

    /**
     * Reported SOY cost basis (or short proceeds) in EUR, converted at Jan 1 of the tax year. Degrades to zero when
     * missing, unconvertible or negative.
     */
    private BigDecimal fallbackAmount(Asset asset, TaxYear taxYear, boolean shortSide) {
        BigDecimal amount = asset.soyCostBasisAmount();
        String currency = asset.soyCostBasisCurrency();
        if (amount == null || currency == null || currency.isBlank()) {
            log.error("Asset {}: no SOY cost basis reported; fallback lot gets zero {}",
                    asset.displayName(), shortSide ? "proceeds" : "cost");
            return BigDecimal.ZERO;
        }
        if (shortSide) {
            amount = amount.abs();
        }
        BigDecimal eur;
        if (EUR.equalsIgnoreCase(currency.strip())) {
            eur = amount;
        } else {
            ConversionResult converted = currencyConverter.convertToEur(amount, currency, taxYear.start());
            if (converted.isUnknown()) {
                log.error("Asset {}: SOY cost basis {} {} could not be converted; fallback lot gets zero value",
                        asset.displayName(), amount, currency);
                return BigDecimal.ZERO;
            }
            eur = converted.orElse(BigDecimal.ZERO);
        }
        if (eur.signum() < 0) {
            log.warn("Asset {}: SOY cost basis {} EUR is negative; using 0", asset.displayName(), eur);
            return BigDecimal.ZERO;
        }
        return eur;
    }

    /** Outcome of seeding one ledger. */
    public enum SoySeed {
        NO_POSITION,
        RECONSTRUCTED,
        FALLBACK
    }

    private static final class ReplayVisitor extends DefaultFinancialEventVisitor<Void> {

        private final FifoLedger ledger;
        private boolean consistent = true;

        private ReplayVisitor(FifoLedger ledger) {
            this.ledger = ledger;
        }

        @Override
        public Void visitTrade(TradeEvent trade) {
            LotConsumption<?> result = switch (trade.type()) {
                case TRADE_BUY_LONG -> {
                    ledger.addLongLot(trade);
                    yield null;
                }
                case TRADE_SELL_SHORT_OPEN -> {
                    ledger.addShortLot(trade);
                    yield null;
                }
                case TRADE_SELL_LONG -> ledger.consumeLongLotsForSale(trade, true);
                case TRADE_BUY_SHORT_COVER -> ledger.consumeShortLotsForCover(trade, true);
                default -> null;
            };
            if (result != null && !result.isConsumed()) {
                consistent = false;
            }
            return null;
        }

        @Override
        public Void visitSplit(SplitEvent split) {
            if (split.newSharesPerOldShare() == null || split.newSharesPerOldShare().signum() <= 0) {
                log.warn("Historical split {} has invalid ratio {}; replay marked inconsistent",
                        split.eventId(), split.newSharesPerOldShare());
                consistent = false;
                return null;
            }
            ledger.adjustLotsForSplit(split);
            return null;
        }

        @Override
        public Void visitStockDividend(StockDividendEvent dividend) {
            ledger.addLotForStockDividend(dividend);
            return null;
        }

        @Override
        protected Void otherwise(FinancialEvent event) {
            log.debug("Event kind {} ({}) has no effect on SOY replay", event.type(), event.eventId());
            return null;
        }
    }
}
