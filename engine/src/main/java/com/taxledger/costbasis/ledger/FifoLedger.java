package com.taxledger.costbasis.ledger;

import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.FundType;
import com.taxledger.domain.RealizationType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.event.CashMergerEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.domain.event.TradeEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-asset FIFO ledger of open long and short lots. Lots are kept sorted by (date, source transaction id), which is
 * the consumption order. Owned by a single calculation run and mutated in event order.
 */
@Slf4j
public class FifoLedger {

    /** Quantity shortfall below this is treated as rounding noise rather than missing lots. */
    static final BigDecimal INSUFFICIENCY_TOLERANCE = new BigDecimal("1e-10");

    private final UUID assetId;
    private final AssetCategory category;
    private final FundType fundType;
    private final NumericContext numeric;
    private final RealizationRecordFactory recordFactory;
    private final List<FifoLot> lots = new ArrayList<>();
    private final List<ShortFifoLot> shortLots = new ArrayList<>();

    public FifoLedger(Asset asset, NumericContext numeric) {
        Objects.requireNonNull(asset, "asset must not be null");
        this.numeric = Objects.requireNonNull(numeric, "numeric context must not be null");
        this.assetId = asset.id();
        this.category = asset.category();
        if (category == AssetCategory.INVESTMENT_FUND && asset.fundType() == FundType.NONE) {
            log.warn("Ledger for fund {} has no fund type; Teilfreistellung rate 0 applies", asset.displayName());
        }
        this.fundType = category == AssetCategory.INVESTMENT_FUND ? FundType.orNone(asset.fundType()) : null;
        this.recordFactory = new RealizationRecordFactory(assetId, category, fundType, numeric);
    }

    public UUID getAssetId() {
        return assetId;
    }

    public AssetCategory getCategory() {
        return category;
    }

    public FundType getFundType() {
        return fundType;
    }

    public List<FifoLot> getLongLots() {
        return Collections.unmodifiableList(lots);
    }

    public List<ShortFifoLot> getShortLots() {
        return Collections.unmodifiableList(shortLots);
    }

    public RealizationRecordFactory getRecordFactory() {
        return recordFactory;
    }

    public void addLongLot(TradeEvent trade) {
        requireTradeType(trade, FinancialEventType.TRADE_BUY_LONG);
        if (trade.quantity() == null || trade.quantity().signum() <= 0 || trade.netAmountEur() == null) {
            log.warn("Buy {} for asset {} has no positive quantity or no EUR cost; no lot created", trade.eventId(), assetId);
            return;
        }
        String sourceId = requireTransactionId(trade);
        BigDecimal quantity = numeric.quantizeQuantity(trade.quantity());
        if (quantity.signum() == 0) {
            log.warn("Buy {} has zero quantity after quantization; no lot created", sourceId);
            return;
        }
        BigDecimal total = trade.netAmountEur().abs();
        lots.add(new FifoLot(trade.eventDate(), quantity, numeric.divide(total, quantity), total, sourceId));
        lots.sort(FifoLot.FIFO_ORDER);
    }

    public void addShortLot(TradeEvent trade) {
        requireTradeType(trade, FinancialEventType.TRADE_SELL_SHORT_OPEN);
        if (trade.quantity() == null || trade.quantity().signum() >= 0 || trade.netAmountEur() == null) {
            log.warn("Short open {} for asset {} has no negative quantity or no EUR proceeds; no lot created", trade.eventId(), assetId);
            return;
        }
        String sourceId = requireTransactionId(trade);
        BigDecimal quantity = numeric.quantizeQuantity(trade.quantity().abs());
        if (quantity.signum() == 0) {
            log.warn("Short open {} has zero quantity after quantization; no lot created", sourceId);
            return;
        }
        BigDecimal total = trade.netAmountEur().abs();
        shortLots.add(new ShortFifoLot(trade.eventDate(), quantity, numeric.divide(total, quantity), total, sourceId));
        shortLots.sort(ShortFifoLot.FIFO_ORDER);
    }

    /**
     * Consumes long lots oldest first for a sale. One record per consumed slice, each carrying the slice's acquisition
     * date and unit cost against the sale's unit proceeds. During {@code replay} no records are produced.
     */
    public LotConsumption<RealizedGainLoss> consumeLongLotsForSale(TradeEvent sale, boolean replay) {
        requireTradeType(sale, FinancialEventType.TRADE_SELL_LONG);
        if (sale.quantity() == null || sale.quantity().signum() >= 0 || sale.netAmountEur() == null) {
            log.warn("Sale {} for asset {} has no negative quantity or no EUR proceeds; nothing consumed", sale.eventId(), assetId);
            return LotConsumption.consumed(List.of());
        }
        BigDecimal required = numeric.quantizeQuantity(sale.quantity().abs());
        if (required.signum() == 0) {
            return LotConsumption.consumed(List.of());
        }
        BigDecimal available = longQuantity();
        if (isShort(required, available)) {
            return insufficient(replay, "Insufficient long lots for sale " + label(sale)
                    + " of asset " + assetId + ": required " + required + ", available " + available);
        }
        BigDecimal unitProceeds = numeric.divide(sale.netAmountEur().abs(), required);
        RealizationType type = TaxCategoryRules.closingType(category, false);
        List<RealizedGainLoss> records = new ArrayList<>();
        BigDecimal remaining = required;
        Iterator<FifoLot> it = lots.iterator();
        while (it.hasNext() && remaining.signum() > 0) {
            FifoLot lot = it.next();
            BigDecimal taken = lot.getQuantity().min(remaining);
            if (taken.compareTo(lot.getQuantity()) == 0) {
                it.remove();
            } else {
                lot.shrinkTo(numeric.subtract(lot.getQuantity(), taken), numeric.mathContext());
            }
            remaining = numeric.subtract(remaining, taken);
            if (!replay) {
                records.add(recordFactory.create(sale.eventId(), lot.getAcquisitionDate(), sale.eventDate(), type, taken,
                        lot.getUnitCostBasisEur(), unitProceeds,
                        numeric.multiply(taken, lot.getUnitCostBasisEur()), numeric.multiply(taken, unitProceeds),
                        false));
            }
        }
        return LotConsumption.consumed(records);
    }

    /**
     * Consumes short lots oldest first for a cover. Gain per slice = opening proceeds - cover cost.
     */
    public LotConsumption<RealizedGainLoss> consumeShortLotsForCover(TradeEvent cover, boolean replay) {
        requireTradeType(cover, FinancialEventType.TRADE_BUY_SHORT_COVER);
        if (cover.quantity() == null || cover.quantity().signum() <= 0 || cover.netAmountEur() == null) {
            log.warn("Cover {} for asset {} has no positive quantity or no EUR cost; nothing consumed", cover.eventId(), assetId);
            return LotConsumption.consumed(List.of());
        }
        BigDecimal required = numeric.quantizeQuantity(cover.quantity());
        if (required.signum() == 0) {
            return LotConsumption.consumed(List.of());
        }
        BigDecimal available = shortQuantity();
        if (isShort(required, available)) {
            return insufficient(replay, "Insufficient short lots for cover " + label(cover)
                    + " of asset " + assetId + ": required " + required + ", available " + available);
        }
        BigDecimal unitCost = numeric.divide(cover.netAmountEur().abs(), required);
        RealizationType type = TaxCategoryRules.closingType(category, true);
        List<RealizedGainLoss> records = new ArrayList<>();
        BigDecimal remaining = required;
        Iterator<ShortFifoLot> it = shortLots.iterator();
        while (it.hasNext() && remaining.signum() > 0) {
            ShortFifoLot lot = it.next();
            BigDecimal taken = lot.getQuantityShorted().min(remaining);
            if (taken.compareTo(lot.getQuantityShorted()) == 0) {
                it.remove();
            } else {
                lot.shrinkTo(numeric.subtract(lot.getQuantityShorted(), taken), numeric.mathContext());
            }
            remaining = numeric.subtract(remaining, taken);
            if (!replay) {
                records.add(recordFactory.create(cover.eventId(), lot.getOpeningDate(), cover.eventDate(), type, taken,
                        unitCost, lot.getUnitProceedsEur(),
                        numeric.multiply(taken, unitCost), numeric.multiply(taken, lot.getUnitProceedsEur()),
                        true));
            }
        }
        return LotConsumption.consumed(records);
    }

    /**
     * Multiplies every lot quantity by the split ratio; totals are unchanged and unit values are recomputed.
     *
     * @throws IllegalArgumentException if the ratio is missing or not positive
     */
    public void adjustLotsForSplit(SplitEvent split) {
        BigDecimal ratio = split.newSharesPerOldShare();
        if (ratio == null || ratio.signum() <= 0) {
            throw new IllegalArgumentException("Split " + split.eventId() + " for asset " + assetId + " has invalid ratio " + ratio);
        }
        log.info("Applying split ratio {} to {} long and {} short lots of asset {}", ratio, lots.size(), shortLots.size(), assetId);
        Iterator<FifoLot> longIt = lots.iterator();
        while (longIt.hasNext()) {
            FifoLot lot = longIt.next();
            BigDecimal newQuantity = numeric.quantizeQuantity(numeric.multiply(lot.getQuantity(), ratio));
            if (newQuantity.signum() == 0) {
                log.warn("Lot {} quantity {} vanished after split ratio {}; lot dropped", lot.getSourceTransactionId(), lot.getQuantity(), ratio);
                longIt.remove();
                continue;
            }
            lot.rescale(newQuantity, numeric.divide(lot.getTotalCostBasisEur(), newQuantity));
        }
        Iterator<ShortFifoLot> shortIt = shortLots.iterator();
        while (shortIt.hasNext()) {
            ShortFifoLot lot = shortIt.next();
            BigDecimal newQuantity = numeric.quantizeQuantity(numeric.multiply(lot.getQuantityShorted(), ratio));
            if (newQuantity.signum() == 0) {
                log.warn("Short lot {} quantity {} vanished after split ratio {}; lot dropped", lot.getSourceTransactionId(), lot.getQuantityShorted(), ratio);
                shortIt.remove();
                continue;
            }
            lot.rescale(newQuantity, numeric.divide(lot.getTotalProceedsEur(), newQuantity));
        }
    }

    /**
     * Liquidates every long lot at the merger's cash price per share, one record per lot, then clears the long side.
     */
    public List<RealizedGainLoss> consumeAllLotsForCashMerger(CashMergerEvent merger) {
        BigDecimal cashPerShare = merger.cashPerShareEur();
        if (cashPerShare == null) {
            throw new IllegalArgumentException("Cash merger " + merger.eventId() + " for asset " + assetId + " has no cash per share in EUR");
        }
        if (lots.isEmpty()) {
            log.info("Cash merger {} for asset {} found no long lots", merger.eventId(), assetId);
            return List.of();
        }
        List<RealizedGainLoss> records = new ArrayList<>(lots.size());
        for (FifoLot lot : lots) {
            records.add(recordFactory.create(merger.eventId(), lot.getAcquisitionDate(), merger.eventDate(),
                    RealizationType.CASH_MERGER_PROCEEDS, lot.getQuantity(),
                    lot.getUnitCostBasisEur(), cashPerShare,
                    lot.getTotalCostBasisEur(), numeric.multiply(lot.getQuantity(), cashPerShare),
                    false));
        }
        lots.clear();
        log.info("Cash merger {} closed {} lots of asset {}", merger.eventId(), records.size(), assetId);
        return records;
    }

    /**
     * Adds a lot dated at the event with the attributed value per new share as unit cost (zero is allowed).
     */
    public void addLotForStockDividend(StockDividendEvent dividend) {
        BigDecimal newShares = dividend.quantityNewShares();
        if (newShares == null || newShares.signum() <= 0) {
            log.info("Stock dividend {} for asset {} has no new shares ({}); no lot added", dividend.eventId(), assetId, newShares);
            return;
        }
        BigDecimal unitValue = dividend.fmvPerNewShareEur();
        if (unitValue == null) {
            throw new IllegalArgumentException("Stock dividend " + dividend.eventId() + " for asset " + assetId + " has no value per new share");
        }
        if (category != AssetCategory.STOCK && category != AssetCategory.INVESTMENT_FUND) {
            log.warn("Stock dividend {} on {} asset {}; verify classification", dividend.eventId(), category, assetId);
        }
        BigDecimal quantity = numeric.quantizeQuantity(newShares);
        String sourceId = firstNonBlank(dividend.corporateActionId(), dividend.transactionId(), "STOCKDIV_" + dividend.eventId());
        lots.add(new FifoLot(dividend.eventDate(), quantity, unitValue, numeric.multiply(quantity, unitValue), sourceId));
        lots.sort(FifoLot.FIFO_ORDER);
    }

    /**
     * Reduces lot cost bases oldest first, never below zero.
     *
     * @return the part of {@code amountEur} not absorbed by any lot; positive excess is taxable income
     */
    public BigDecimal reduceCostBasisForCapitalRepayment(BigDecimal amountEur) {
        if (amountEur.signum() <= 0 || lots.isEmpty()) {
            return amountEur;
        }
        BigDecimal remaining = amountEur;
        for (FifoLot lot : lots) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal reduction = remaining.min(lot.getTotalCostBasisEur());
            BigDecimal newTotal = numeric.subtract(lot.getTotalCostBasisEur(), reduction);
            lot.reduceTotalCostBasis(newTotal, numeric.divide(newTotal, lot.getQuantity()));
            remaining = numeric.subtract(remaining, reduction);
        }
        return remaining;
    }

    /** Closes long option contracts oldest first and reports the premium paid per slice. */
    public LotConsumption<ConsumedLotDetail> consumeLongOptionLots(BigDecimal contracts) {
        requireOption("consumeLongOptionLots");
        BigDecimal required = numeric.quantizeQuantity(contracts);
        if (required.signum() <= 0) {
            log.warn("Non-positive contract quantity {} for long option lots of asset {}", required, assetId);
            return LotConsumption.consumed(List.of());
        }
        BigDecimal available = longQuantity();
        if (isShort(required, available)) {
            return LotConsumption.insufficient(false, "Insufficient long option contracts for asset " + assetId
                    + ": required " + required + ", available " + available);
        }
        List<ConsumedLotDetail> details = new ArrayList<>();
        BigDecimal remaining = required;
        Iterator<FifoLot> it = lots.iterator();
        while (it.hasNext() && remaining.signum() > 0) {
            FifoLot lot = it.next();
            BigDecimal taken = lot.getQuantity().min(remaining);
            if (taken.compareTo(lot.getQuantity()) == 0) {
                it.remove();
            } else {
                lot.shrinkTo(numeric.subtract(lot.getQuantity(), taken), numeric.mathContext());
            }
            details.add(new ConsumedLotDetail(taken, lot.getUnitCostBasisEur(), lot.getAcquisitionDate(), lot.getSourceTransactionId()));
            remaining = numeric.subtract(remaining, taken);
        }
        return LotConsumption.consumed(details);
    }

    /** Closes short option contracts oldest first and reports the premium received per slice. */
    public LotConsumption<ConsumedLotDetail> consumeShortOptionLots(BigDecimal contracts) {
        requireOption("consumeShortOptionLots");
        BigDecimal required = numeric.quantizeQuantity(contracts);
        if (required.signum() <= 0) {
            log.warn("Non-positive contract quantity {} for short option lots of asset {}", required, assetId);
            return LotConsumption.consumed(List.of());
        }
        BigDecimal available = shortQuantity();
        if (isShort(required, available)) {
            return LotConsumption.insufficient(false, "Insufficient short option contracts for asset " + assetId
                    + ": required " + required + ", available " + available);
        }
        List<ConsumedLotDetail> details = new ArrayList<>();
        BigDecimal remaining = required;
        Iterator<ShortFifoLot> it = shortLots.iterator();
        while (it.hasNext() && remaining.signum() > 0) {
            ShortFifoLot lot = it.next();
            BigDecimal taken = lot.getQuantityShorted().min(remaining);
            if (taken.compareTo(lot.getQuantityShorted()) == 0) {
                it.remove();
            } else {
                lot.shrinkTo(numeric.subtract(lot.getQuantityShorted(), taken), numeric.mathContext());
            }
            details.add(new ConsumedLotDetail(taken, lot.getUnitProceedsEur(), lot.getOpeningDate(), lot.getSourceTransactionId()));
            remaining = numeric.subtract(remaining, taken);
        }
        return LotConsumption.consumed(details);
    }

    public BigDecimal longQuantity() {
        return lots.stream().map(FifoLot::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal shortQuantity() {
        return shortLots.stream().map(ShortFifoLot::getQuantityShorted).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Net position: long minus short, quantized to the quantity scale. */
    public BigDecimal currentPositionQuantity() {
        return numeric.quantizeQuantity(longQuantity().subtract(shortQuantity()));
    }

    void replaceLots(List<FifoLot> newLots, List<ShortFifoLot> newShortLots) {
        lots.clear();
        lots.addAll(newLots);
        lots.sort(FifoLot.FIFO_ORDER);
        shortLots.clear();
        shortLots.addAll(newShortLots);
        shortLots.sort(ShortFifoLot.FIFO_ORDER);
    }

    private boolean isShort(BigDecimal required, BigDecimal available) {
        return required.subtract(available).compareTo(INSUFFICIENCY_TOLERANCE) > 0;
    }

    private <T> LotConsumption<T> insufficient(boolean replay, String reason) {
        if (replay) {
            log.warn("History replay: {}", reason);
        } else {
            log.error(reason);
        }
        return LotConsumption.insufficient(replay, reason);
    }

    private void requireOption(String operation) {
        if (category != AssetCategory.OPTION) {
            throw new IllegalStateException(operation + " called on " + category + " asset " + assetId);
        }
    }

    private static void requireTradeType(TradeEvent trade, FinancialEventType expected) {
        if (trade.type() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " but got " + trade.type() + " for trade " + trade.eventId());
        }
    }

    private static String requireTransactionId(TradeEvent trade) {
        if (trade.transactionId() == null || trade.transactionId().isBlank()) {
            throw new IllegalArgumentException("Trade " + trade.eventId() + " has no transaction id; required for FIFO lot identity");
        }
        return trade.transactionId();
    }

    private static String label(TradeEvent trade) {
        return trade.transactionId() != null ? trade.transactionId() : String.valueOf(trade.eventId());
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("no non-blank candidate");
    }
}
